package dtm.ioc.exceptions;

import dtm.ioc.prototypes.Token;
import lombok.Getter;

@Getter
public class InvalidRegistrationException extends DependencyContainerException{
    private final Token<?> token;

    public InvalidRegistrationException(String message, Token<?> token, Throwable th){
        super(message, th);
        this.token = token;
    }
    public InvalidRegistrationException(String message, Token<?> token){
        super(message);
        this.token = token;
    }
}
