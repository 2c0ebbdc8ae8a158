package dtm.ioc.testing;

import dtm.ioc.common.ComponentRegistor;
import dtm.ioc.core.DependencyScope;
import dtm.ioc.prototypes.Lifecycle;
import dtm.ioc.prototypes.Registration;
import dtm.ioc.prototypes.ScopeFactory;
import dtm.ioc.prototypes.Token;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Acumula overrides e os aplica em um escopo filho novo no {@link #compile()}.
 */
@Slf4j
public final class TestingScopeBuilder {
    private final DependencyScope parent;
    private final Map<Token<?>, Registration<?>> overrides;
    private String name;

    TestingScopeBuilder(DependencyScope parent) {
        this.parent = parent;
        this.overrides = new LinkedHashMap<>();
    }

    public TestingScopeBuilder name(@NonNull String name) {
        this.name = name;
        return this;
    }

    public <T> OverrideBy<T> overrideToken(@NonNull Token<T> token) {
        return new OverrideBy<>(token);
    }

    public <T> OverrideBy<T> overrideToken(@NonNull Class<T> type) {
        return overrideToken(Token.of(type));
    }

    public DependencyScope compile() {
        DependencyScope scope = (name == null) ? parent.createChild() : parent.createChild(name);
        for (Registration<?> registration : overrides.values()) {
            scope.override(registration);
        }
        log.debug("Escopo de teste '{}' criado com overrides {}", scope.getName(), overrides.keySet());
        return scope;
    }

    public final class OverrideBy<T> {
        private final Token<T> token;

        private OverrideBy(Token<T> token) {
            this.token = token;
        }

        public TestingScopeBuilder useValue(@NonNull T value) {
            return add(ComponentRegistor.ofConstant(token, value));
        }

        public TestingScopeBuilder useFactory(@NonNull ScopeFactory<? extends T> factory) {
            return add(ComponentRegistor.ofFactory(token, factory, parent.getConfigurations().getDefaultLifecycle()));
        }

        public TestingScopeBuilder useClass(@NonNull Class<? extends T> implementation, Token<?>... dependencies) {
            return add(ComponentRegistor.ofClass(token, parent.getConfigurations().getDefaultLifecycle(), implementation, dependencies));
        }

        private TestingScopeBuilder add(Registration<T> registration) {
            overrides.put(token, registration);
            return TestingScopeBuilder.this;
        }
    }
}
