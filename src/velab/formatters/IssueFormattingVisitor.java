package velab.formatters;

import velab.check.*;
import velab.errors.IssueVisitor;
import velab.errors.IssueWithContext;
import velab.model.verilog.ArgAssign;
import velab.model.verilog.ModuleItem;
import velab.program.DuplicateDeclarationIssue;
import velab.program.NoRootDeclarationIssue;
import velab.program.RootInstantiationMismatchIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(DuplicateDeclarationIssue duplicateDeclarationIssue) throws IOException {
		out.write("module ");
		out.write(duplicateDeclarationIssue.getDeclaration().getId().toString());
		out.write(" ");
		out.write(duplicateDeclarationIssue.getDeclaration().getLocation().prettyString());
		out.write(" is already declared ");
		out.write(duplicateDeclarationIssue.getExisting().getLocation().prettyString());
		return null;
	}

	@Override
	public Void visit(NoRootDeclarationIssue noRootDeclarationIssue) throws IOException {
		out.write("cannot evaluate ");
		writeItem(noRootDeclarationIssue.getItem());
		out.write(" before any module has been declared");
		return null;
	}

	@Override
	public Void visit(RootInstantiationMismatchIssue rootInstantiationMismatchIssue) throws IOException {
		out.write("the root item must instantiate module ");
		out.write(rootInstantiationMismatchIssue.getExpected().toString());
		out.write(", found ");
		writeItem(rootInstantiationMismatchIssue.getItem());
		return null;
	}

	@Override
	public Void visit(UnresolvedModuleIssue unresolvedModuleIssue) throws IOException {
		out.write("instance ");
		out.write(unresolvedModuleIssue.getInstantiation().getInstanceName());
		out.write(" ");
		out.write(unresolvedModuleIssue.getInstantiation().getLocation().prettyString());
		out.write(" refers to undeclared module ");
		out.write(unresolvedModuleIssue.getInstantiation().getModuleId().toString());
		return null;
	}

	@Override
	public Void visit(UnresolvedReferenceIssue unresolvedReferenceIssue) throws IOException {
		out.write("could not resolve name ");
		out.write(unresolvedReferenceIssue.getName().toString());
		out.write(" ");
		out.write(unresolvedReferenceIssue.getLocation().prettyString());
		return null;
	}

	@Override
	public Void visit(ArgumentMismatchIssue argumentMismatchIssue) throws IOException {
		String kind = argumentMismatchIssue.getKind() == ArgumentMismatchIssue.Kind.PARAMETER ? "parameter" : "port";
		ArgAssign argument = argumentMismatchIssue.getArgument();
		out.write("instance ");
		out.write(argumentMismatchIssue.getInstantiation().getInstanceName());
		out.write(" of module ");
		out.write(argumentMismatchIssue.getInstantiation().getModuleId().toString());
		if (argument.isNamed()) {
			out.write(" binds unknown ");
			out.write(kind);
			out.write(" ");
			out.write(argument.getName().get());
		} else {
			out.write(" binds too many ");
			out.write(kind);
			out.write("s");
		}
		out.write(" ");
		out.write(argument.getLocation().prettyString());
		return null;
	}

	@Override
	public Void visit(NameConflictIssue nameConflictIssue) throws IOException {
		out.write("name ");
		out.write(nameConflictIssue.getName().toString());
		out.write(" ");
		out.write(nameConflictIssue.getLocation().prettyString());
		out.write(" conflicts with an earlier definition ");
		out.write(nameConflictIssue.getPrevious().prettyString());
		return null;
	}

	@Override
	public Void visit(NonConstantExpressionIssue nonConstantExpressionIssue) throws IOException {
		out.write("expression ");
		nonConstantExpressionIssue.getExpression().accept(new ExpressionFormattingVisitor(out));
		out.write(" ");
		out.write(nonConstantExpressionIssue.getExpression().getLocation().prettyString());
		out.write(" is not a constant");
		return null;
	}

	@Override
	public Void visit(InvalidAssignmentTargetIssue invalidAssignmentTargetIssue) throws IOException {
		out.write("continuous assignment ");
		out.write(invalidAssignmentTargetIssue.getAssign().getLocation().prettyString());
		out.write(" cannot drive ");
		writeItem(invalidAssignmentTargetIssue.getTarget());
		return null;
	}

	@Override
	public Void visit(GenerateLoopLimitIssue generateLoopLimitIssue) throws IOException {
		out.write("generate loop over ");
		out.write(generateLoopLimitIssue.getLoop().getGenvar());
		out.write(" ");
		out.write(generateLoopLimitIssue.getLoop().getLocation().prettyString());
		out.write(" does not terminate within ");
		out.write(Integer.toString(generateLoopLimitIssue.getLimit()));
		out.write(" iterations");
		return null;
	}

	@Override
	public Void visit(InstantiationDepthIssue instantiationDepthIssue) throws IOException {
		out.write("instance ");
		out.write(instantiationDepthIssue.getPath().toString());
		out.write(" exceeds the maximum hierarchy depth of ");
		out.write(Integer.toString(instantiationDepthIssue.getLimit()));
		return null;
	}

	private void writeItem(ModuleItem item) throws IOException {
		item.accept(new ModuleItemFormattingVisitor(out));
	}
}
