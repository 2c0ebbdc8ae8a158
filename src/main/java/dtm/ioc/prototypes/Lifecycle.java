package dtm.ioc.prototypes;

/**
 * Política que define se a instância resolvida é guardada no cache do escopo de origem.
 * <p>
 * {@link #SINGLETON} e {@link #SCOPED} compartilham a mesma regra de cache: uma instância por
 * escopo de origem. {@link #SCOPED} existe para deixar explícito, no registro, que a instância
 * pertence a um escopo de curta duração (requisição, teste).
 */
public enum Lifecycle {
    SINGLETON(true),
    SCOPED(true),
    TRANSIENT(false);

    private final boolean cached;

    Lifecycle(boolean cached) {
        this.cached = cached;
    }

    public boolean isCached() {
        return cached;
    }
}
