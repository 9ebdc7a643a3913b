package velab.formatters;

import velab.model.verilog.*;

import java.io.IOException;

public class VerilogNodeFormattingVisitor extends VerilogNodeVisitor<Void, IOException> {
	private final IndentingWriter out;

	public VerilogNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(ModuleDeclaration moduleDeclaration) throws IOException {
		if (!moduleDeclaration.getAttributes().isEmpty()) {
			moduleDeclaration.getAttributes().accept(this);
			out.write(" ");
		}
		out.write("module ");
		out.write(moduleDeclaration.getId().toString());
		out.write(";");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (ModuleItem item : moduleDeclaration.getItems()) {
				out.newLine();
				item.accept(new ModuleItemFormattingVisitor(out));
			}
		}
		out.newLine();
		out.write("endmodule");
		return null;
	}

	@Override
	public Void visit(ModuleItem moduleItem) throws IOException {
		moduleItem.accept(new ModuleItemFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GenerateBlock generateBlock) throws IOException {
		out.write("begin");
		if (generateBlock.getLabel().isPresent()) {
			out.write(" : ");
			out.write(generateBlock.getLabel().get());
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (ModuleItem item : generateBlock.getItems()) {
				out.newLine();
				item.accept(new ModuleItemFormattingVisitor(out));
			}
		}
		out.newLine();
		out.write("end");
		return null;
	}

	@Override
	public Void visit(CaseGenerateItem caseGenerateItem) throws IOException {
		if (caseGenerateItem.isDefault()) {
			out.write("default");
		} else {
			FormattingTools.writeCommaSeparated(out, caseGenerateItem.getMatches(),
					e -> e.accept(new ExpressionFormattingVisitor(out)));
		}
		out.write(": ");
		caseGenerateItem.getBlock().accept(this);
		return null;
	}

	@Override
	public Void visit(ArgAssign argAssign) throws IOException {
		if (argAssign.getName().isPresent()) {
			out.write(".");
			out.write(argAssign.getName().get());
			out.write("(");
			argAssign.getValue().accept(new ExpressionFormattingVisitor(out));
			out.write(")");
		} else {
			argAssign.getValue().accept(new ExpressionFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(Attributes attributes) throws IOException {
		out.write("(* ");
		FormattingTools.writeCommaSeparated(out, attributes.getSpecs(), s -> s.accept(this));
		out.write(" *)");
		return null;
	}

	@Override
	public Void visit(AttrSpec attrSpec) throws IOException {
		out.write(attrSpec.getKey());
		if (attrSpec.getValue().isPresent()) {
			out.write(" = ");
			attrSpec.getValue().get().accept(new ExpressionFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(Expression expression) throws IOException {
		expression.accept(new ExpressionFormattingVisitor(out));
		return null;
	}
}
