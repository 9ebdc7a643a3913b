package velab.formatters;

import velab.model.verilog.*;

import java.io.IOException;

public class ModuleItemFormattingVisitor extends ModuleItemVisitor<Void, IOException> {
	private final IndentingWriter out;

	public ModuleItemFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeDeclaration(String keyword, Declaration declaration) throws IOException {
		out.write(keyword);
		out.write(" ");
		out.write(declaration.getName());
		if (declaration.getValue().isPresent()) {
			out.write(" = ");
			declaration.getValue().get().accept(new ExpressionFormattingVisitor(out));
		}
		out.write(";");
	}

	private void writeBlock(GenerateBlock block) throws IOException {
		block.accept(new VerilogNodeFormattingVisitor(out));
	}

	@Override
	public Void visit(PortDeclaration portDeclaration) throws IOException {
		String keyword = portDeclaration.getDirection() == PortDeclaration.Direction.INPUT ? "input" : "output";
		writeDeclaration(keyword, portDeclaration);
		return null;
	}

	@Override
	public Void visit(GenvarDeclaration genvarDeclaration) throws IOException {
		writeDeclaration("genvar", genvarDeclaration);
		return null;
	}

	@Override
	public Void visit(IntegerDeclaration integerDeclaration) throws IOException {
		writeDeclaration("integer", integerDeclaration);
		return null;
	}

	@Override
	public Void visit(LocalparamDeclaration localparamDeclaration) throws IOException {
		writeDeclaration("localparam", localparamDeclaration);
		return null;
	}

	@Override
	public Void visit(NetDeclaration netDeclaration) throws IOException {
		writeDeclaration("wire", netDeclaration);
		return null;
	}

	@Override
	public Void visit(ParameterDeclaration parameterDeclaration) throws IOException {
		writeDeclaration("parameter", parameterDeclaration);
		return null;
	}

	@Override
	public Void visit(RegDeclaration regDeclaration) throws IOException {
		writeDeclaration("reg", regDeclaration);
		return null;
	}

	@Override
	public Void visit(ContinuousAssign continuousAssign) throws IOException {
		out.write("assign ");
		continuousAssign.getLHS().accept(new ExpressionFormattingVisitor(out));
		out.write(" = ");
		continuousAssign.getRHS().accept(new ExpressionFormattingVisitor(out));
		out.write(";");
		return null;
	}

	@Override
	public Void visit(ModuleInstantiation moduleInstantiation) throws IOException {
		VerilogNodeFormattingVisitor nodeFormatter = new VerilogNodeFormattingVisitor(out);
		if (!moduleInstantiation.getAttributes().isEmpty()) {
			moduleInstantiation.getAttributes().accept(nodeFormatter);
			out.write(" ");
		}
		out.write(moduleInstantiation.getModuleId().toString());
		if (!moduleInstantiation.getParameters().isEmpty()) {
			out.write(" #(");
			FormattingTools.writeCommaSeparated(out, moduleInstantiation.getParameters(), a -> a.accept(nodeFormatter));
			out.write(")");
		}
		out.write(" ");
		out.write(moduleInstantiation.getInstanceName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, moduleInstantiation.getPorts(), a -> a.accept(nodeFormatter));
		out.write(");");
		return null;
	}

	@Override
	public Void visit(IfGenerateConstruct ifGenerateConstruct) throws IOException {
		out.write("if (");
		ifGenerateConstruct.getCondition().accept(new ExpressionFormattingVisitor(out));
		out.write(") ");
		writeBlock(ifGenerateConstruct.getYes());
		if (ifGenerateConstruct.getNo().isPresent()) {
			out.write(" else ");
			writeBlock(ifGenerateConstruct.getNo().get());
		}
		return null;
	}

	@Override
	public Void visit(CaseGenerateConstruct caseGenerateConstruct) throws IOException {
		out.write("case (");
		caseGenerateConstruct.getSubject().accept(new ExpressionFormattingVisitor(out));
		out.write(")");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (CaseGenerateItem item : caseGenerateConstruct.getItems()) {
				out.newLine();
				item.accept(new VerilogNodeFormattingVisitor(out));
			}
		}
		out.newLine();
		out.write("endcase");
		return null;
	}

	@Override
	public Void visit(LoopGenerateConstruct loopGenerateConstruct) throws IOException {
		ExpressionFormattingVisitor expressionFormatter = new ExpressionFormattingVisitor(out);
		out.write("for (");
		out.write(loopGenerateConstruct.getGenvar());
		out.write(" = ");
		loopGenerateConstruct.getInit().accept(expressionFormatter);
		out.write("; ");
		loopGenerateConstruct.getCondition().accept(expressionFormatter);
		out.write("; ");
		out.write(loopGenerateConstruct.getGenvar());
		out.write(" = ");
		loopGenerateConstruct.getUpdate().accept(expressionFormatter);
		out.write(") ");
		writeBlock(loopGenerateConstruct.getBody());
		return null;
	}
}
