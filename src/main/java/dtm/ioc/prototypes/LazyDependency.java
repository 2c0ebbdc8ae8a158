package dtm.ioc.prototypes;

/**
 * Representa uma dependência resolvida de forma preguiçosa (lazy): a resolução só acontece
 * na primeira chamada a {@link #get()}.
 *
 * @param <T> o tipo da dependência gerenciada.
 */
public interface LazyDependency<T> {
    /**
     * Resolve a dependência na primeira chamada e devolve sempre a mesma instância depois disso.
     *
     * @return a instância da dependência.
     */
    T get();

    /**
     * Verifica se a dependência já foi resolvida por este handle, sem disparar a resolução.
     *
     * @return {@code true} se {@link #get()} já concluiu com sucesso.
     */
    boolean isPresent();

    /**
     * @return o token que será resolvido.
     */
    Token<T> getToken();
}
