package dtm.ioc.core;

import dtm.ioc.prototypes.Lifecycle;

/**
 * Configurações de um escopo. Escopos filhos herdam as configurações do pai.
 */
public interface ScopeConfigurations {

    default DuplicateRegistrationPolicy getDuplicateRegistrationPolicy() {
        return DuplicateRegistrationPolicy.REPLACE;
    }

    /**
     * Ciclo de vida usado pelos atalhos de registro que não recebem um {@link Lifecycle}.
     */
    default Lifecycle getDefaultLifecycle() {
        return Lifecycle.SINGLETON;
    }

    /**
     * Se {@code true}, {@link DependencyScope#close()} fecha as instâncias {@link AutoCloseable}
     * construídas pelo escopo.
     */
    default boolean closeInstancesOnClose() {
        return true;
    }
}
