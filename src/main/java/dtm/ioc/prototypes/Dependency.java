package dtm.ioc.prototypes;

import java.util.List;

/**
 * Visão somente leitura de uma dependência registrada em um escopo.
 * <p>
 * Permite inspecionar o registro (token, ciclo de vida, dependências declaradas) e o estado
 * do cache local sem passar pelo fluxo de resolução. Útil para diagnóstico e testes.
 */
public abstract class Dependency {
    public abstract Token<?> getToken();
    public abstract Lifecycle getLifecycle();
    public abstract List<Token<?>> getDependencies();
    public abstract boolean isResolved();

    /**
     * @return a instância em cache no escopo ou {@code null} se ainda não foi resolvida
     */
    public abstract Object getInstance();
}
