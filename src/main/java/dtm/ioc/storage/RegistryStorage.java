package dtm.ioc.storage;

import dtm.ioc.core.DuplicateRegistrationPolicy;
import dtm.ioc.exceptions.InvalidRegistrationException;
import dtm.ioc.prototypes.Registration;
import dtm.ioc.prototypes.Token;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mapa local de token para registro. Não constrói instâncias e não conhece escopos ancestrais;
 * a busca na cadeia é feita pelo escopo.
 */
@Slf4j
public class RegistryStorage {
    private final Map<Token<?>, Registration<?>> registrations;

    public RegistryStorage() {
        this.registrations = new ConcurrentHashMap<>();
    }

    /**
     * Adiciona ou substitui o registro do token, conforme a política.
     *
     * @return o registro substituído, se houver
     */
    public Optional<Registration<?>> register(@NonNull Registration<?> registration, @NonNull DuplicateRegistrationPolicy policy) {
        final Token<?> token = registration.getToken();
        registration.getStrategy().validate(token);

        if(policy == DuplicateRegistrationPolicy.REJECT){
            Registration<?> existing = registrations.putIfAbsent(token, registration);
            if(existing != null){
                throw new InvalidRegistrationException("Token ja registrado: " + token, token);
            }
            return Optional.empty();
        }

        Registration<?> previous = registrations.put(token, registration);
        if(previous != null){
            log.debug("Registro de {} substituído: {} -> {}", token, previous.getStrategy(), registration.getStrategy());
        }
        return Optional.ofNullable(previous);
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<Registration<T>> lookup(@NonNull Token<T> token) {
        return Optional.ofNullable((Registration<T>) registrations.get(token));
    }

    public boolean contains(Token<?> token) {
        return registrations.containsKey(token);
    }

    public Optional<Registration<?>> remove(Token<?> token) {
        return Optional.ofNullable(registrations.remove(token));
    }

    public List<Registration<?>> getRegistrations() {
        return new ArrayList<>(registrations.values());
    }

    public int size() {
        return registrations.size();
    }
}
