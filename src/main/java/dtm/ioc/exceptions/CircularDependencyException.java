package dtm.ioc.exceptions;

import dtm.ioc.prototypes.Token;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class CircularDependencyException extends DependencyContainerException{
    private final List<Token<?>> cycle;

    public CircularDependencyException(List<Token<?>> cycle){
        super("Dependência circular detectada: " + cycle.stream()
                .map(Token::toString)
                .collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }
}
