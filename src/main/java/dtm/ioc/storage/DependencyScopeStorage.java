package dtm.ioc.storage;

import dtm.ioc.core.DependencyScope;
import dtm.ioc.core.DuplicateRegistrationPolicy;
import dtm.ioc.core.ScopeConfigurations;
import dtm.ioc.exceptions.DependencyContainerException;
import dtm.ioc.exceptions.InvalidRegistrationException;
import dtm.ioc.exceptions.ScopeClosedException;
import dtm.ioc.exceptions.UnregisteredTokenException;
import dtm.ioc.prototypes.ClassStrategy;
import dtm.ioc.prototypes.ConstantStrategy;
import dtm.ioc.prototypes.Dependency;
import dtm.ioc.prototypes.FactoryStrategy;
import dtm.ioc.prototypes.LazyDependency;
import dtm.ioc.prototypes.Lifecycle;
import dtm.ioc.prototypes.Registration;
import dtm.ioc.prototypes.ScopeFactory;
import dtm.ioc.prototypes.Token;
import dtm.ioc.storage.lazy.Lazy;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
public class DependencyScopeStorage implements DependencyScope {

    private final DependencyScopeStorage parent;
    private final RegistryStorage registry;
    private final Map<Token<?>, Object> cache;
    private final Map<Token<?>, ReentrantLock> constructionLocks;
    private final Deque<Object> ownedInstances;
    private final DependencyResolver resolver;
    private final AtomicBoolean closed;
    private final AtomicInteger childCounter;

    @Getter
    private final String name;

    @Getter
    private final ScopeConfigurations configurations;

    public static DependencyScopeStorage newRootScope() {
        return newRootScope("root", new ScopeConfigurationsStorage());
    }

    public static DependencyScopeStorage newRootScope(String name) {
        return newRootScope(name, new ScopeConfigurationsStorage());
    }

    public static DependencyScopeStorage newRootScope(@NonNull String name, @NonNull ScopeConfigurations configurations) {
        log.debug("Criando escopo raiz '{}' com {}", name, configurations);
        return new DependencyScopeStorage(null, name, configurations);
    }

    private DependencyScopeStorage(DependencyScopeStorage parent, String name, ScopeConfigurations configurations) {
        this.parent = parent;
        this.name = name;
        this.configurations = ScopeConfigurationsStorage.from(configurations);
        this.registry = new RegistryStorage();
        this.cache = new ConcurrentHashMap<>();
        this.constructionLocks = new ConcurrentHashMap<>();
        this.ownedInstances = new ConcurrentLinkedDeque<>();
        this.resolver = new DependencyResolver(this);
        this.closed = new AtomicBoolean(false);
        this.childCounter = new AtomicInteger(0);
    }

    @Override
    public DependencyScope createChild() {
        return createChild(name + "/child-" + childCounter.incrementAndGet());
    }

    @Override
    public DependencyScope createChild(@NonNull String childName) {
        throwIfClosed();
        log.debug("Criando escopo filho '{}' a partir de '{}'", childName, name);
        return new DependencyScopeStorage(this, childName, configurations);
    }

    @Override
    public DependencyScope getParent() {
        return parent;
    }

    @Override
    public <T> T resolve(@NonNull Token<T> token) {
        throwIfClosed();
        return resolver.resolve(token);
    }

    @Override
    public <T> T resolve(Class<T> reference) {
        return resolve(Token.of(reference));
    }

    @Override
    public <T> T resolve(Class<T> reference, String qualifier) {
        return resolve(Token.of(reference, qualifier));
    }

    @Override
    public <T> Optional<T> tryResolve(Token<T> token) {
        try{
            return Optional.of(resolve(token));
        }catch (UnregisteredTokenException e){
            if(!token.equals(e.getToken())){
                throw e;
            }
            return Optional.empty();
        }
    }

    @Override
    public <T> LazyDependency<T> lazy(@NonNull Token<T> token) {
        throwIfClosed();
        return Lazy.of(token, () -> resolve(token));
    }

    @Override
    public boolean isRegistered(Token<?> token) {
        throwIfClosed();
        for (DependencyScopeStorage current = this; current != null; current = current.parent) {
            if(current.registry.contains(token)) return true;
        }
        return false;
    }

    @Override
    public boolean isResolved(Token<?> token) {
        throwIfClosed();
        return cache.containsKey(token);
    }

    @Override
    public List<Dependency> getRegisteredDependencies() {
        throwIfClosed();
        List<Dependency> dependencies = new ArrayList<>();
        for (Registration<?> registration : registry.getRegistrations()) {
            dependencies.add(DependencyObject.builder()
                    .token(registration.getToken())
                    .lifecycle(registration.getLifecycle())
                    .dependencies(registration.getStrategy().getDependencies())
                    .instance(cache.get(registration.getToken()))
                    .build());
        }
        dependencies.sort(Comparator.comparing(d -> d.getToken().toString()));
        return dependencies;
    }

    @Override
    public <T> void register(@NonNull Registration<T> registration) throws InvalidRegistrationException {
        throwIfClosed();
        final Token<T> token = registration.getToken();
        withConstructionLock(token, () -> {
            if(cache.containsKey(token)){
                throw new InvalidRegistrationException(
                        "Token "+token+" já foi resolvido no escopo '"+name+"'; use override para substituí-lo",
                        token
                );
            }
            registry.register(registration, configurations.getDuplicateRegistrationPolicy());
        });
    }

    @Override
    public <T> void registerFactory(Token<T> token, ScopeFactory<? extends T> factory, Lifecycle lifecycle) throws InvalidRegistrationException {
        register(Registration.of(token, FactoryStrategy.of(factory), lifecycle));
    }

    @Override
    public <T> void registerFactory(Token<T> token, ScopeFactory<? extends T> factory) throws InvalidRegistrationException {
        registerFactory(token, factory, configurations.getDefaultLifecycle());
    }

    @Override
    public <T> void registerClass(Token<T> token, Class<? extends T> implementation, Token<?>... dependencies) throws InvalidRegistrationException {
        registerClass(token, configurations.getDefaultLifecycle(), implementation, dependencies);
    }

    @Override
    public <T> void registerClass(Token<T> token, Lifecycle lifecycle, Class<? extends T> implementation, Token<?>... dependencies) throws InvalidRegistrationException {
        register(Registration.of(token, ClassStrategy.<T>of(implementation, dependencies), lifecycle));
    }

    @Override
    public <T> void registerConstant(Token<T> token, T value) throws InvalidRegistrationException {
        register(Registration.of(token, ConstantStrategy.of(value), Lifecycle.SINGLETON));
    }

    @Override
    public <T> void override(Token<T> token, T value) {
        override(Registration.of(token, ConstantStrategy.of(value), Lifecycle.SINGLETON));
    }

    @Override
    public <T> void overrideFactory(Token<T> token, ScopeFactory<? extends T> factory) {
        override(Registration.of(token, FactoryStrategy.of(factory), configurations.getDefaultLifecycle()));
    }

    @Override
    public <T> void override(@NonNull Registration<T> registration) {
        throwIfClosed();
        final Token<T> token = registration.getToken();
        withConstructionLock(token, () -> {
            registry.register(registration, DuplicateRegistrationPolicy.REPLACE);
            Object evicted = cache.remove(token);
            if(evicted != null){
                log.debug("[{}] override de {}: instância em cache descartada", name, token);
            }else{
                log.debug("[{}] override de {}", name, token);
            }
        });
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if(!closed.compareAndSet(false, true)) return;

        List<Exception> failures = new ArrayList<>();
        if(configurations.closeInstancesOnClose()){
            Object instance;
            while ((instance = ownedInstances.pollLast()) != null) {
                if(instance instanceof AutoCloseable closeable){
                    try{
                        closeable.close();
                    }catch (Exception e){
                        log.warn("[{}] Falha ao fechar a instância {}", name, instance.getClass().getName(), e);
                        failures.add(e);
                    }
                }
            }
        }
        ownedInstances.clear();
        cache.clear();
        constructionLocks.clear();
        log.debug("Escopo '{}' encerrado", name);

        if(!failures.isEmpty()){
            DependencyContainerException exception = new DependencyContainerException(
                    "Falha ao encerrar o escopo '"+name+"'",
                    failures.get(0)
            );
            failures.subList(1, failures.size()).forEach(exception::addSuppressed);
            throw exception;
        }
    }

    @Override
    public String toString() {
        return "DependencyScope[" + name + "]";
    }

    <T> Registration<T> lookupRegistration(Token<T> token) {
        int searched = 0;
        for (DependencyScopeStorage current = this; current != null; current = current.parent) {
            current.throwIfClosed();
            searched++;
            Optional<Registration<T>> registration = current.registry.lookup(token);
            if(registration.isPresent()){
                return registration.get();
            }
        }
        throw new UnregisteredTokenException(token, searched);
    }

    Object getCachedInstance(Token<?> token) {
        return cache.get(token);
    }

    void storeInstance(Token<?> token, Object instance, boolean owned) {
        cache.put(token, instance);
        if(owned){
            ownedInstances.addLast(instance);
        }
    }

    ReentrantLock getConstructionLock(Token<?> token) {
        return constructionLocks.computeIfAbsent(token, k -> new ReentrantLock());
    }

    private void withConstructionLock(Token<?> token, Runnable action) {
        ReentrantLock lock = getConstructionLock(token);
        lock.lock();
        try{
            action.run();
        }finally {
            lock.unlock();
        }
    }

    private void throwIfClosed() {
        if(isClosed()) throw new ScopeClosedException(name);
    }
}
