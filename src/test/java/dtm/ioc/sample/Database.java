package dtm.ioc.sample;

import java.util.List;
import java.util.Map;

public interface Database {
    List<Map<String, Object>> query(String queryString);
}
