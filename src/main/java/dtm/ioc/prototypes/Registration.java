package dtm.ioc.prototypes;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Entrada do registro: token, estratégia de construção e ciclo de vida.
 *
 * @param <T> tipo produzido
 */
@Getter
@ToString
public final class Registration<T> {
    private final Token<T> token;
    private final Strategy<? extends T> strategy;
    private final Lifecycle lifecycle;

    private Registration(Token<T> token, Strategy<? extends T> strategy, Lifecycle lifecycle) {
        this.token = token;
        this.strategy = strategy;
        this.lifecycle = lifecycle;
    }

    public static <T> Registration<T> of(@NonNull Token<T> token, @NonNull Strategy<? extends T> strategy, @NonNull Lifecycle lifecycle) {
        return new Registration<>(token, strategy, lifecycle);
    }
}
