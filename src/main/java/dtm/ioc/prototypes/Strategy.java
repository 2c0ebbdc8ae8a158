package dtm.ioc.prototypes;

import dtm.ioc.core.DependencyScopeGetter;

import java.util.List;

/**
 * Estratégia de construção associada a um token.
 *
 * @param <T> tipo produzido
 * @see FactoryStrategy
 * @see ClassStrategy
 * @see ConstantStrategy
 */
public abstract class Strategy<T> {

    /**
     * Tokens que o contêiner deve resolver antes de chamar {@link #instantiate}, na ordem
     * em que serão entregues.
     */
    public abstract List<Token<?>> getDependencies();

    /**
     * Constrói a instância.
     *
     * @param dependencies instâncias já resolvidas, na ordem de {@link #getDependencies()}
     * @param scope        escopo de origem da resolução
     */
    public abstract T instantiate(Object[] dependencies, DependencyScopeGetter scope);

    /**
     * Valida a estratégia no momento do registro.
     */
    public void validate(Token<?> token) {
    }

    /**
     * Constantes não são construídas pelo escopo; por isso não pertencem a ele.
     */
    public boolean isConstant() {
        return false;
    }
}
