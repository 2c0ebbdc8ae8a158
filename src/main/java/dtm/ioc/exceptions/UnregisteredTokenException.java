package dtm.ioc.exceptions;

import dtm.ioc.prototypes.Token;
import lombok.Getter;

/**
 * Lançada quando nenhum escopo da cadeia (local e ancestrais) possui registro para o token solicitado.
 * Indica erro de configuração: token digitado errado ou registro ausente.
 */
@Getter
public class UnregisteredTokenException extends DependencyContainerException{
    private final Token<?> token;

    public UnregisteredTokenException(Token<?> token, int searchedScopes){
        super("Nenhum registro encontrado para "+token+" (escopos pesquisados: "+searchedScopes+")");
        this.token = token;
    }
}
