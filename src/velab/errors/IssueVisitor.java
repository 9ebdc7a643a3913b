package velab.errors;

import velab.check.*;
import velab.program.DuplicateDeclarationIssue;
import velab.program.NoRootDeclarationIssue;
import velab.program.RootInstantiationMismatchIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(DuplicateDeclarationIssue duplicateDeclarationIssue) throws E;
	public abstract T visit(NoRootDeclarationIssue noRootDeclarationIssue) throws E;
	public abstract T visit(RootInstantiationMismatchIssue rootInstantiationMismatchIssue) throws E;
	public abstract T visit(UnresolvedModuleIssue unresolvedModuleIssue) throws E;
	public abstract T visit(UnresolvedReferenceIssue unresolvedReferenceIssue) throws E;
	public abstract T visit(ArgumentMismatchIssue argumentMismatchIssue) throws E;
	public abstract T visit(NameConflictIssue nameConflictIssue) throws E;
	public abstract T visit(NonConstantExpressionIssue nonConstantExpressionIssue) throws E;
	public abstract T visit(InvalidAssignmentTargetIssue invalidAssignmentTargetIssue) throws E;
	public abstract T visit(GenerateLoopLimitIssue generateLoopLimitIssue) throws E;
	public abstract T visit(InstantiationDepthIssue instantiationDepthIssue) throws E;
}
