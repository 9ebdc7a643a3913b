package velab.analyze;

import velab.model.verilog.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects a node and everything below it, including state attached during elaboration: generated blocks,
 * inlined blocks and, optionally, the instances attached to instantiations.
 */
public class Descendants extends VerilogNodeVisitor<Void, RuntimeException> {

	private final List<VerilogNode> found;
	private final boolean throughInstances;
	private final ItemWalker itemWalker;
	private final ExpressionWalker expressionWalker;

	private Descendants(boolean throughInstances) {
		this.found = new ArrayList<>();
		this.throughInstances = throughInstances;
		this.itemWalker = new ItemWalker();
		this.expressionWalker = new ExpressionWalker();
	}

	public static List<VerilogNode> collect(VerilogNode root, boolean throughInstances) {
		Descendants d = new Descendants(throughInstances);
		root.accept(d);
		return d.found;
	}

	@Override
	public Void visit(ModuleDeclaration moduleDeclaration) {
		found.add(moduleDeclaration);
		moduleDeclaration.getAttributes().accept(this);
		for (ModuleItem item : moduleDeclaration.getItems()) {
			item.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(ModuleItem moduleItem) {
		found.add(moduleItem);
		moduleItem.accept(itemWalker);
		return null;
	}

	@Override
	public Void visit(GenerateBlock generateBlock) {
		found.add(generateBlock);
		for (ModuleItem item : generateBlock.getItems()) {
			item.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(CaseGenerateItem caseGenerateItem) {
		found.add(caseGenerateItem);
		for (Expression match : caseGenerateItem.getMatches()) {
			match.accept(this);
		}
		caseGenerateItem.getBlock().accept(this);
		return null;
	}

	@Override
	public Void visit(ArgAssign argAssign) {
		found.add(argAssign);
		argAssign.getValue().accept(this);
		return null;
	}

	@Override
	public Void visit(Attributes attributes) {
		found.add(attributes);
		for (AttrSpec spec : attributes.getSpecs()) {
			spec.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(AttrSpec attrSpec) {
		found.add(attrSpec);
		attrSpec.getValue().ifPresent(v -> v.accept(this));
		return null;
	}

	@Override
	public Void visit(Expression expression) {
		found.add(expression);
		expression.accept(expressionWalker);
		return null;
	}

	private class ItemWalker extends ModuleItemVisitor<Void, RuntimeException> {

		private void declaration(Declaration declaration) {
			declaration.getValue().ifPresent(v -> v.accept(Descendants.this));
		}

		private void generated(GenerateConstruct construct) {
			for (GenerateBlock block : construct.getGenerated()) {
				block.accept(Descendants.this);
			}
		}

		@Override
		public Void visit(PortDeclaration portDeclaration) {
			return null;
		}

		@Override
		public Void visit(GenvarDeclaration genvarDeclaration) {
			return null;
		}

		@Override
		public Void visit(IntegerDeclaration integerDeclaration) {
			declaration(integerDeclaration);
			return null;
		}

		@Override
		public Void visit(LocalparamDeclaration localparamDeclaration) {
			declaration(localparamDeclaration);
			return null;
		}

		@Override
		public Void visit(NetDeclaration netDeclaration) {
			declaration(netDeclaration);
			return null;
		}

		@Override
		public Void visit(ParameterDeclaration parameterDeclaration) {
			declaration(parameterDeclaration);
			return null;
		}

		@Override
		public Void visit(RegDeclaration regDeclaration) {
			declaration(regDeclaration);
			return null;
		}

		@Override
		public Void visit(ContinuousAssign continuousAssign) {
			continuousAssign.getLHS().accept(Descendants.this);
			continuousAssign.getRHS().accept(Descendants.this);
			return null;
		}

		@Override
		public Void visit(ModuleInstantiation moduleInstantiation) {
			moduleInstantiation.getAttributes().accept(Descendants.this);
			for (ArgAssign a : moduleInstantiation.getParameters()) {
				a.accept(Descendants.this);
			}
			for (ArgAssign a : moduleInstantiation.getPorts()) {
				a.accept(Descendants.this);
			}
			moduleInstantiation.getInlined().ifPresent(b -> b.accept(Descendants.this));
			if (throughInstances) {
				moduleInstantiation.getInstance().ifPresent(i -> i.accept(Descendants.this));
			}
			return null;
		}

		@Override
		public Void visit(IfGenerateConstruct ifGenerateConstruct) {
			ifGenerateConstruct.getCondition().accept(Descendants.this);
			ifGenerateConstruct.getYes().accept(Descendants.this);
			ifGenerateConstruct.getNo().ifPresent(b -> b.accept(Descendants.this));
			generated(ifGenerateConstruct);
			return null;
		}

		@Override
		public Void visit(CaseGenerateConstruct caseGenerateConstruct) {
			caseGenerateConstruct.getSubject().accept(Descendants.this);
			for (CaseGenerateItem item : caseGenerateConstruct.getItems()) {
				item.accept(Descendants.this);
			}
			generated(caseGenerateConstruct);
			return null;
		}

		@Override
		public Void visit(LoopGenerateConstruct loopGenerateConstruct) {
			loopGenerateConstruct.getInit().accept(Descendants.this);
			loopGenerateConstruct.getCondition().accept(Descendants.this);
			loopGenerateConstruct.getUpdate().accept(Descendants.this);
			loopGenerateConstruct.getBody().accept(Descendants.this);
			generated(loopGenerateConstruct);
			return null;
		}
	}

	private class ExpressionWalker extends ExpressionVisitor<Void, RuntimeException> {
		@Override
		public Void visit(NumberLiteral numberLiteral) {
			return null;
		}

		@Override
		public Void visit(Reference reference) {
			return null;
		}

		@Override
		public Void visit(UnaryExpression unaryExpression) {
			unaryExpression.getOperand().accept(Descendants.this);
			return null;
		}

		@Override
		public Void visit(BinaryExpression binaryExpression) {
			binaryExpression.getLHS().accept(Descendants.this);
			binaryExpression.getRHS().accept(Descendants.this);
			return null;
		}

		@Override
		public Void visit(ConditionalExpression conditionalExpression) {
			conditionalExpression.getCondition().accept(Descendants.this);
			conditionalExpression.getYes().accept(Descendants.this);
			conditionalExpression.getNo().accept(Descendants.this);
			return null;
		}
	}
}
