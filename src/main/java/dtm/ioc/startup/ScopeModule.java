package dtm.ioc.startup;

import dtm.ioc.core.DependencyScopeRegistor;

/**
 * Agrupa registros relacionados de uma aplicação. Aplicado pelo {@link ManagedScopeStartup}
 * sobre o escopo raiz, na ordem em que os módulos foram adicionados.
 */
@FunctionalInterface
public interface ScopeModule {
    void configure(DependencyScopeRegistor registor);
}
