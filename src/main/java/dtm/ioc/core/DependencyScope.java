package dtm.ioc.core;

import dtm.ioc.exceptions.ScopeClosedException;

/**
 * Interface principal de um escopo de dependências: um registro e um cache isolados,
 * opcionalmente encadeados a um escopo pai.
 *
 * Estende as interfaces:
 * <ul>
 *   <li>{@link DependencyScopeGetter} - para obtenção de dependências;</li>
 *   <li>{@link DependencyScopeRegistor} - para registro e override de dependências.</li>
 * </ul>
 *
 * Um escopo raiz vive durante todo o processo. Cada cenário de teste deve usar um escopo filho
 * próprio, descartado ao final, para que caches e overrides não vazem entre testes.
 */
public interface DependencyScope extends
        DependencyScopeGetter,
        DependencyScopeRegistor,
        AutoCloseable
{
    /**
     * Cria um escopo filho com cache vazio. Registros feitos no filho só são visíveis nele e
     * nos seus descendentes; registros do pai são herdados.
     */
    DependencyScope createChild();

    /**
     * Igual a {@link #createChild()}, com nome explícito para logs.
     */
    DependencyScope createChild(String name);

    /**
     * @return o escopo pai ou {@code null} para o escopo raiz.
     */
    DependencyScope getParent();

    String getName();

    ScopeConfigurations getConfigurations();

    boolean isClosed();

    /**
     * Encerra o escopo, fechando as instâncias construídas por ele que implementam {@link AutoCloseable}.
     * Depois disso qualquer operação lança {@link ScopeClosedException}. O escopo pai não é afetado.
     */
    @Override
    void close();
}
