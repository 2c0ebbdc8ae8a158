package dtm.ioc.exceptions;

public class DependencyContainerException extends RuntimeException{

    public DependencyContainerException(String message){
        super(message);
    }

    public DependencyContainerException(String message, Throwable th){
        super(message, th);
    }

}
