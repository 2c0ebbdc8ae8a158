package dtm.ioc.core;

import dtm.ioc.exceptions.InvalidRegistrationException;
import dtm.ioc.prototypes.Lifecycle;
import dtm.ioc.prototypes.Registration;
import dtm.ioc.prototypes.ScopeFactory;
import dtm.ioc.prototypes.Token;

/**
 * Interface para registro e substituição de dependências no escopo.
 *
 * Registrar não constrói nada: a construção só acontece na primeira resolução.
 */
public interface DependencyScopeRegistor {

    /**
     * Registra uma entrada neste escopo.
     *
     * @param registration registro a ser adicionado
     * @throws InvalidRegistrationException se o token já foi resolvido neste escopo, se a estratégia
     *                                      for inválida, ou se o token já estiver registrado e a política
     *                                      de duplicidade for {@code REJECT}
     */
    <T> void register(Registration<T> registration) throws InvalidRegistrationException;

    /**
     * Registra uma fábrica com o ciclo de vida informado.
     */
    <T> void registerFactory(Token<T> token, ScopeFactory<? extends T> factory, Lifecycle lifecycle) throws InvalidRegistrationException;

    /**
     * Registra uma fábrica com o ciclo de vida padrão das configurações do escopo.
     */
    <T> void registerFactory(Token<T> token, ScopeFactory<? extends T> factory) throws InvalidRegistrationException;

    /**
     * Registra uma classe concreta cujo construtor recebe as dependências informadas,
     * com o ciclo de vida padrão das configurações do escopo.
     */
    <T> void registerClass(Token<T> token, Class<? extends T> implementation, Token<?>... dependencies) throws InvalidRegistrationException;

    /**
     * Registra uma classe concreta com o ciclo de vida informado.
     */
    <T> void registerClass(Token<T> token, Lifecycle lifecycle, Class<? extends T> implementation, Token<?>... dependencies) throws InvalidRegistrationException;

    /**
     * Registra um valor já construído. Constantes nunca são invocadas e não pertencem ao escopo.
     */
    <T> void registerConstant(Token<T> token, T value) throws InvalidRegistrationException;

    /**
     * Substitui o registro do token neste escopo por um valor constante e descarta a instância em cache
     * deste escopo. O escopo pai nunca é alterado.
     */
    <T> void override(Token<T> token, T value);

    /**
     * Substitui o registro do token neste escopo por uma fábrica, com o ciclo de vida padrão,
     * e descarta a instância em cache deste escopo.
     */
    <T> void overrideFactory(Token<T> token, ScopeFactory<? extends T> factory);

    /**
     * Substitui o registro neste escopo e descarta a instância em cache deste escopo.
     * <p>
     * A instância descartada pode continuar em uso por dependentes já construídos; por isso ela
     * segue pertencendo ao escopo e só é fechada no {@link DependencyScope#close()}.
     */
    <T> void override(Registration<T> registration);
}
