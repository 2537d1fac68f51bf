package pl.marcinmilkowski.line_search.search;

/**
 * Decorator that rebuilds the delegate's corpus before every query.
 *
 * <p>Each query therefore sees the file as it is when the query arrives. There
 * is no locking and no snapshot guarantee against a concurrent writer of the
 * file: a query racing a rewrite may see either version.</p>
 */
public class RereadOnQuerySearch implements SearchAlgorithm {

    private final SearchAlgorithm delegate;

    public RereadOnQuerySearch(SearchAlgorithm delegate) {
        this.delegate = delegate;
    }

    @Override
    public void reload() {
        delegate.reload();
    }

    @Override
    public boolean search(String query) {
        delegate.reload();
        return delegate.search(query);
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    public SearchAlgorithm getDelegate() {
        return delegate;
    }
}
