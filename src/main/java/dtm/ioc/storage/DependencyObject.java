package dtm.ioc.storage;

import dtm.ioc.prototypes.Dependency;
import dtm.ioc.prototypes.Lifecycle;
import dtm.ioc.prototypes.Token;
import lombok.*;

import java.util.List;

@Data
@ToString
@AllArgsConstructor
@Builder
@EqualsAndHashCode(callSuper = false)
public class DependencyObject extends Dependency {
    private Token<?> token;
    private Lifecycle lifecycle;
    private List<Token<?>> dependencies;

    @ToString.Exclude
    private Object instance;

    @Override
    public boolean isResolved() {
        return instance != null;
    }
}
