package velab.scope;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of an AST node. Caches key on UIDs rather than on nodes so that dropping a node's cached state is a
 * map removal.
 */
public final class UID {
	private static final AtomicLong counter = new AtomicLong();

	private final long id;

	public UID() {
		this.id = counter.incrementAndGet();
	}

	public long getId() {
		return id;
	}

	@Override
	public String toString() {
		return "UID(" + id + ")";
	}
}
