package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base of the closed family of compile-time generate constructs. Consumers dispatch over the variants through
 * {@link GenerateConstructVisitor}, so adding a variant breaks every consumer that has not handled it.
 *
 * Expanding a construct attaches the blocks it produced; an expanded construct that selected nothing has an
 * empty, but present, list of generated blocks.
 */
public abstract class GenerateConstruct extends ModuleItem {

	private List<GenerateBlock> generated;

	public GenerateConstruct(SourceLocation location) {
		super(location);
		this.generated = null;
	}

	public boolean isElaborated() {
		return generated != null;
	}

	public List<GenerateBlock> getGenerated() {
		return generated == null ? Collections.emptyList() : Collections.unmodifiableList(generated);
	}

	public void setGenerated(List<GenerateBlock> generated) {
		this.generated = new ArrayList<>(generated);
	}

	public void clearGenerated() {
		this.generated = null;
	}

	@Override
	public abstract GenerateConstruct copy();

	public abstract <T, E extends Throwable> T accept(GenerateConstructVisitor<T, E> v) throws E;

}
