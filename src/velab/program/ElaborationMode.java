package velab.program;

/**
 * How one call to the worklist behaves. A fresh mode is passed to every call; nothing about it outlives the
 * call.
 */
public final class ElaborationMode {
	private final boolean checkerOff;
	private final boolean warnUnresolved;
	private final boolean localOnly;
	private final boolean expandInstantiations;
	private final boolean expandGenerates;

	public ElaborationMode(boolean checkerOff, boolean warnUnresolved, boolean localOnly,
	                       boolean expandInstantiations, boolean expandGenerates) {
		this.checkerOff = checkerOff;
		this.warnUnresolved = warnUnresolved;
		this.localOnly = localOnly;
		this.expandInstantiations = expandInstantiations;
		this.expandGenerates = expandGenerates;
	}

	/**
	 * Validates a template on its own: nothing is expanded, resolution stays inside the template and
	 * unresolvable hierarchical names are reported as warnings.
	 */
	public static ElaborationMode local(boolean checkerOff) {
		return new ElaborationMode(checkerOff, true, true, false, false);
	}

	/**
	 * Expands everything and resolves names across the whole hierarchy.
	 */
	public static ElaborationMode full(boolean checkerOff) {
		return new ElaborationMode(checkerOff, false, false, true, true);
	}

	public boolean isCheckerOff() {
		return checkerOff;
	}

	public boolean isWarnUnresolved() {
		return warnUnresolved;
	}

	public boolean isLocalOnly() {
		return localOnly;
	}

	public boolean isExpandInstantiations() {
		return expandInstantiations;
	}

	public boolean isExpandGenerates() {
		return expandGenerates;
	}

	@Override
	public String toString() {
		return (localOnly ? "local" : "full") + (checkerOff ? ", unchecked" : "");
	}
}
