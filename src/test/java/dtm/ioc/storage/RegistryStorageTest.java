package dtm.ioc.storage;

import dtm.ioc.core.DuplicateRegistrationPolicy;
import dtm.ioc.exceptions.InvalidRegistrationException;
import dtm.ioc.prototypes.ConstantStrategy;
import dtm.ioc.prototypes.Lifecycle;
import dtm.ioc.prototypes.Registration;
import dtm.ioc.prototypes.Token;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RegistryStorageTest {

    private static final Token<String> NAME = Token.named("name", String.class);

    private RegistryStorage registry;

    @BeforeEach
    void setUp() {
        registry = new RegistryStorage();
    }

    @Test
    void lookupIsAPureRead() {
        assertThat(registry.lookup(NAME)).isEmpty();
        assertThat(registry.contains(NAME)).isFalse();

        Registration<String> registration = Registration.of(NAME, ConstantStrategy.of("a"), Lifecycle.SINGLETON);
        registry.register(registration, DuplicateRegistrationPolicy.REPLACE);

        assertThat(registry.lookup(NAME)).containsSame(registration);
        assertThat(registry.lookup(NAME)).containsSame(registration);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void replaceReturnsPreviousRegistration() {
        Registration<String> first = Registration.of(NAME, ConstantStrategy.of("a"), Lifecycle.SINGLETON);
        Registration<String> second = Registration.of(NAME, ConstantStrategy.of("b"), Lifecycle.TRANSIENT);

        assertThat(registry.register(first, DuplicateRegistrationPolicy.REPLACE)).isEmpty();
        assertThat(registry.register(second, DuplicateRegistrationPolicy.REPLACE)).containsSame(first);
        assertThat(registry.lookup(NAME)).containsSame(second);
    }

    @Test
    void rejectKeepsTheFirstRegistration() {
        Registration<String> first = Registration.of(NAME, ConstantStrategy.of("a"), Lifecycle.SINGLETON);
        registry.register(first, DuplicateRegistrationPolicy.REJECT);

        assertThrows(InvalidRegistrationException.class, () -> registry.register(
                Registration.of(NAME, ConstantStrategy.of("b"), Lifecycle.SINGLETON),
                DuplicateRegistrationPolicy.REJECT));
        assertThat(registry.lookup(NAME)).containsSame(first);
    }

    @Test
    void removeDropsTheEntry() {
        registry.register(Registration.of(NAME, ConstantStrategy.of("a"), Lifecycle.SINGLETON), DuplicateRegistrationPolicy.REPLACE);

        assertThat(registry.remove(NAME)).isPresent();
        assertThat(registry.getRegistrations()).isEmpty();
    }
}
