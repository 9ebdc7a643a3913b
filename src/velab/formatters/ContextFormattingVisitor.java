package velab.formatters;

import velab.check.WhileElaboratingScope;
import velab.errors.ContextVisitor;
import velab.program.WhileDeclaringModule;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileElaboratingScope whileElaboratingScope) throws IOException {
		out.write("while elaborating ");
		out.write(whileElaboratingScope.getPath().toString());
		return null;
	}

	@Override
	public Void visit(WhileDeclaringModule whileDeclaringModule) throws IOException {
		out.write("while declaring module ");
		out.write(whileDeclaringModule.getModuleId().toString());
		return null;
	}

}
