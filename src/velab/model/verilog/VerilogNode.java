package velab.model.verilog;

import velab.Unreachable;
import velab.formatters.IndentingWriter;
import velab.formatters.VerilogNodeFormattingVisitor;
import velab.scope.UID;
import velab.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

public abstract class VerilogNode {

	private final SourceLocation location;
	private final UID uid;

	public VerilogNode(SourceLocation location) {
		this.location = location;
		this.uid = new UID();
	}

	/**
	 * Copies the source-level structure of this node. State derived during elaboration (attached instances,
	 * generated blocks, inlined blocks, initial values) is not copied, and every copied node gets a fresh UID.
	 */
	public abstract VerilogNode copy();

	public SourceLocation getLocation() {
		return location;
	}

	public UID getUID() {
		return uid;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	public abstract <T, E extends Throwable> T accept(VerilogNodeVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new VerilogNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
