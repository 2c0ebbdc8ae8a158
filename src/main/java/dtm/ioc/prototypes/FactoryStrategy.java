package dtm.ioc.prototypes;

import dtm.ioc.core.DependencyScopeGetter;
import lombok.NonNull;

import java.util.List;

public final class FactoryStrategy<T> extends Strategy<T> {
    private final ScopeFactory<? extends T> factory;

    private FactoryStrategy(ScopeFactory<? extends T> factory) {
        this.factory = factory;
    }

    public static <T> FactoryStrategy<T> of(@NonNull ScopeFactory<? extends T> factory) {
        return new FactoryStrategy<>(factory);
    }

    @Override
    public List<Token<?>> getDependencies() {
        return List.of();
    }

    @Override
    public T instantiate(Object[] dependencies, DependencyScopeGetter scope) {
        return factory.create(scope);
    }

    @Override
    public String toString() {
        return "FactoryStrategy";
    }
}
