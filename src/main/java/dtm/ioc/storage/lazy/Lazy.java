package dtm.ioc.storage.lazy;

import dtm.ioc.prototypes.LazyDependency;
import dtm.ioc.prototypes.Token;

import java.util.function.Supplier;

public class Lazy {

    public static <T> LazyDependency<T> of(Token<T> token, Supplier<T> supplier) {
        return new LazyDependency<>() {
            private volatile T dependency;

            @Override
            public T get() {
                T value = dependency;
                if(value == null){
                    synchronized (this){
                        value = dependency;
                        if(value == null){
                            value = supplier.get();
                            dependency = value;
                        }
                    }
                }
                return value;
            }

            @Override
            public boolean isPresent() {
                return dependency != null;
            }

            @Override
            public Token<T> getToken() {
                return token;
            }

            @Override
            public String toString() {
                return "Lazy[" + token + (dependency != null ? ", resolvido" : "") + "]";
            }
        };
    }

}
