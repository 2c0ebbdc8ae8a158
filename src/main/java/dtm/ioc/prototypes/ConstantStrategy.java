package dtm.ioc.prototypes;

import dtm.ioc.core.DependencyScopeGetter;
import dtm.ioc.exceptions.InvalidRegistrationException;
import lombok.NonNull;

import java.util.List;

public final class ConstantStrategy<T> extends Strategy<T> {
    private final T value;

    private ConstantStrategy(T value) {
        this.value = value;
    }

    public static <T> ConstantStrategy<T> of(@NonNull T value) {
        return new ConstantStrategy<>(value);
    }

    @Override
    public List<Token<?>> getDependencies() {
        return List.of();
    }

    @Override
    public T instantiate(Object[] dependencies, DependencyScopeGetter scope) {
        return value;
    }

    @Override
    public void validate(Token<?> token) {
        if(!token.getType().isInstance(value)){
            throw new InvalidRegistrationException(
                    "Constante do tipo "+value.getClass().getName()+" incompatível com o token "+token,
                    token
            );
        }
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public String toString() {
        return "ConstantStrategy[" + value.getClass().getSimpleName() + "]";
    }
}
