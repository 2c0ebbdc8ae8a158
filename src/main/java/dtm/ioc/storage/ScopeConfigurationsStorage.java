package dtm.ioc.storage;

import dtm.ioc.core.DuplicateRegistrationPolicy;
import dtm.ioc.core.ScopeConfigurations;
import dtm.ioc.prototypes.Lifecycle;
import lombok.Builder;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

@Slf4j
@ToString
public class ScopeConfigurationsStorage implements ScopeConfigurations {

    public static final String DUPLICATES_PROPERTY = "kernon.scope.duplicates";
    public static final String DEFAULT_LIFECYCLE_PROPERTY = "kernon.scope.default-lifecycle";
    public static final String CLOSE_INSTANCES_PROPERTY = "kernon.scope.close-instances";

    private final DuplicateRegistrationPolicy duplicateRegistrationPolicy;
    private final Lifecycle defaultLifecycle;
    private final boolean closeInstances;

    @Builder
    public ScopeConfigurationsStorage(
            DuplicateRegistrationPolicy duplicateRegistrationPolicy,
            Lifecycle defaultLifecycle,
            Boolean closeInstances
    ) {
        ScopeConfigurations defaults = new ScopeConfigurations() {};
        this.duplicateRegistrationPolicy = duplicateRegistrationPolicy != null
                ? duplicateRegistrationPolicy
                : defaults.getDuplicateRegistrationPolicy();
        this.defaultLifecycle = defaultLifecycle != null ? defaultLifecycle : defaults.getDefaultLifecycle();
        this.closeInstances = closeInstances != null ? closeInstances : defaults.closeInstancesOnClose();
    }

    /**
     * Configurações padrão, sobrescritas pelas propriedades de sistema
     * {@value #DUPLICATES_PROPERTY}, {@value #DEFAULT_LIFECYCLE_PROPERTY} e {@value #CLOSE_INSTANCES_PROPERTY}.
     */
    public ScopeConfigurationsStorage() {
        this(
                readEnum(DUPLICATES_PROPERTY, DuplicateRegistrationPolicy.class),
                readEnum(DEFAULT_LIFECYCLE_PROPERTY, Lifecycle.class),
                readBoolean(CLOSE_INSTANCES_PROPERTY)
        );
    }

    public static ScopeConfigurationsStorage from(ScopeConfigurations configurations) {
        if(configurations instanceof ScopeConfigurationsStorage storage){
            return storage;
        }
        return new ScopeConfigurationsStorage(
                configurations.getDuplicateRegistrationPolicy(),
                configurations.getDefaultLifecycle(),
                configurations.closeInstancesOnClose()
        );
    }

    @Override
    public DuplicateRegistrationPolicy getDuplicateRegistrationPolicy() {
        return duplicateRegistrationPolicy;
    }

    @Override
    public Lifecycle getDefaultLifecycle() {
        return defaultLifecycle;
    }

    @Override
    public boolean closeInstancesOnClose() {
        return closeInstances;
    }

    private static <E extends Enum<E>> E readEnum(String property, Class<E> type) {
        String value = System.getProperty(property);
        if(value == null || value.isBlank()) return null;
        try{
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        }catch (IllegalArgumentException e){
            log.warn("Valor inválido para a propriedade {}: '{}'. Usando o padrão.", property, value);
            return null;
        }
    }

    private static Boolean readBoolean(String property) {
        String value = System.getProperty(property);
        if(value == null || value.isBlank()) return null;
        return Boolean.parseBoolean(value.trim());
    }
}
