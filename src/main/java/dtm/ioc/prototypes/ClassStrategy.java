package dtm.ioc.prototypes;

import dtm.ioc.core.DependencyScopeGetter;
import dtm.ioc.exceptions.InvalidRegistrationException;
import dtm.ioc.exceptions.NewInstanceException;
import lombok.Getter;
import lombok.NonNull;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;

/**
 * Descrição de uma classe concreta e dos tokens que o seu construtor recebe.
 * <p>
 * Os tokens são declarados explicitamente, na ordem dos parâmetros. O construtor escolhido é o
 * único construtor declarado cuja quantidade de parâmetros é igual à quantidade de tokens.
 *
 * <pre>
 *   ClassStrategy.of(Repository.class, Token.named("database"))
 * </pre>
 *
 * @param <T> tipo produzido
 */
public final class ClassStrategy<T> extends Strategy<T> {

    @Getter
    private final Class<? extends T> implementation;
    private final List<Token<?>> dependencies;
    private volatile Constructor<? extends T> constructor;

    private ClassStrategy(Class<? extends T> implementation, List<Token<?>> dependencies) {
        this.implementation = implementation;
        this.dependencies = dependencies;
    }

    public static <T> ClassStrategy<T> of(@NonNull Class<? extends T> implementation, @NonNull Token<?>... dependencies) {
        return new ClassStrategy<>(implementation, List.of(dependencies));
    }

    @Override
    public List<Token<?>> getDependencies() {
        return dependencies;
    }

    @Override
    public void validate(Token<?> token) {
        if(implementation.isInterface() || implementation.isEnum() || Modifier.isAbstract(implementation.getModifiers())){
            throw new InvalidRegistrationException("Registre uma classe concreta para: "+token, token);
        }
        if(!token.getType().isAssignableFrom(implementation)){
            throw new InvalidRegistrationException(
                    "A classe "+implementation.getName()+" não é atribuível ao token "+token,
                    token
            );
        }
        this.constructor = selectConstructor(token);
    }

    @Override
    public T instantiate(Object[] dependencies, DependencyScopeGetter scope) {
        Constructor<? extends T> selected = constructor;
        if(selected == null){
            throw new NewInstanceException("Estratégia não validada para a classe: "+implementation.getName(), implementation);
        }
        try{
            return selected.newInstance(dependencies);
        }catch (InvocationTargetException e){
            Throwable cause = e.getCause();
            if(cause instanceof RuntimeException runtimeException) throw runtimeException;
            if(cause instanceof Error error) throw error;
            throw new NewInstanceException("Erro ao construir "+implementation.getName()+": "+cause, implementation, cause);
        }catch (InstantiationException | IllegalAccessException | IllegalArgumentException e){
            throw new NewInstanceException(
                    "Falha ao criar instância de "+implementation.getName()+" com as dependências "+dependencies()
                            +": "+e.getMessage(),
                    implementation,
                    e
            );
        }
    }

    @SuppressWarnings("unchecked")
    private Constructor<? extends T> selectConstructor(Token<?> token) {
        List<Constructor<?>> candidates = Arrays.stream(implementation.getDeclaredConstructors())
                .filter(c -> !c.isSynthetic())
                .filter(c -> c.getParameterCount() == dependencies.size())
                .toList();

        if(candidates.size() != 1){
            throw new InvalidRegistrationException(
                    "Esperado exatamente um construtor com "+dependencies.size()+" parâmetro(s) em "
                            +implementation.getName()+", encontrados: "+candidates.size(),
                    token
            );
        }

        Constructor<? extends T> selected = (Constructor<? extends T>) candidates.get(0);
        selected.setAccessible(true);
        return selected;
    }

    private String dependencies() {
        return dependencies.toString();
    }

    @Override
    public String toString() {
        return "ClassStrategy[" + implementation.getSimpleName() + " <- " + dependencies + "]";
    }
}
