package dtm.ioc.common;

import dtm.ioc.prototypes.ClassStrategy;
import dtm.ioc.prototypes.ConstantStrategy;
import dtm.ioc.prototypes.FactoryStrategy;
import dtm.ioc.prototypes.Lifecycle;
import dtm.ioc.prototypes.Registration;
import dtm.ioc.prototypes.ScopeFactory;
import dtm.ioc.prototypes.Token;
import lombok.NonNull;

public final class ComponentRegistor {

    private ComponentRegistor() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Cria um registro de fábrica com ciclo de vida {@link Lifecycle#SINGLETON}.
     *
     * @param <T>     tipo da dependência
     * @param token   token da dependência
     * @param factory fábrica que recebe o escopo de origem
     * @return registro pronto para uso
     */
    public static <T> Registration<T> ofFactory(@NonNull Token<T> token, @NonNull ScopeFactory<? extends T> factory){
        return ofFactory(token, factory, Lifecycle.SINGLETON);
    }

    /**
     * Cria um registro de fábrica com o ciclo de vida informado.
     *
     * @param <T>       tipo da dependência
     * @param token     token da dependência
     * @param factory   fábrica que recebe o escopo de origem
     * @param lifecycle ciclo de vida do registro
     * @return registro pronto para uso
     */
    public static <T> Registration<T> ofFactory(@NonNull Token<T> token, @NonNull ScopeFactory<? extends T> factory, @NonNull Lifecycle lifecycle){
        return Registration.of(token, FactoryStrategy.of(factory), lifecycle);
    }

    public static <T> Registration<T> ofClass(@NonNull Token<T> token, @NonNull Class<? extends T> implementation, Token<?>... dependencies){
        return ofClass(token, Lifecycle.SINGLETON, implementation, dependencies);
    }

    public static <T> Registration<T> ofClass(@NonNull Token<T> token, @NonNull Lifecycle lifecycle, @NonNull Class<? extends T> implementation, Token<?>... dependencies){
        return Registration.of(token, ClassStrategy.<T>of(implementation, dependencies), lifecycle);
    }

    public static <T> Registration<T> ofConstant(@NonNull Token<T> token, @NonNull T value){
        return Registration.of(token, ConstantStrategy.of(value), Lifecycle.SINGLETON);
    }

}
