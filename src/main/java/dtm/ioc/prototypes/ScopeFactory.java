package dtm.ioc.prototypes;

import dtm.ioc.core.DependencyScopeGetter;

/**
 * Função de construção que recebe o escopo de origem da resolução.
 * Dependências obtidas através de {@code scope} respeitam os overrides desse escopo.
 *
 * @param <T> tipo produzido
 */
@FunctionalInterface
public interface ScopeFactory<T> {
    T create(DependencyScopeGetter scope);
}
