package flint.ds;

import java.io.IOException;
import java.util.List;

/**
 * Finder behind annotation queries of the form {@code <finder>:<query>}.
 */
public interface AnnotationReader {

    /**
     * Finds annotations within a time range
     * @param folder folder of the request
     * @param query  finder specific query (the part after the first ':')
     * @param from   range start, epoch milliseconds, inclusive
     * @param to     range end, epoch milliseconds, inclusive
     * @return annotations ordered by time
     * @throws IOException if the query cannot be answered
     */
    List<Annotation> find(String folder, String query, long from, long to) throws IOException;
}
