package velab.program;

import velab.scope.Scope;

/**
 * A queued node together with the scope it was found in.
 */
public final class Pending<T> {
	private final T node;
	private final Scope scope;

	public Pending(T node, Scope scope) {
		this.node = node;
		this.scope = scope;
	}

	public T getNode() {
		return node;
	}

	public Scope getScope() {
		return scope;
	}
}
