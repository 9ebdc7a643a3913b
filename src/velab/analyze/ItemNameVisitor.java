package velab.analyze;

import velab.model.verilog.*;

import java.util.Optional;

/**
 * The name an item introduces into its enclosing scope, if any.
 */
public class ItemNameVisitor extends ModuleItemVisitor<Optional<String>, RuntimeException> {

	@Override
	public Optional<String> visit(PortDeclaration portDeclaration) {
		return Optional.of(portDeclaration.getName());
	}

	@Override
	public Optional<String> visit(GenvarDeclaration genvarDeclaration) {
		return Optional.of(genvarDeclaration.getName());
	}

	@Override
	public Optional<String> visit(IntegerDeclaration integerDeclaration) {
		return Optional.of(integerDeclaration.getName());
	}

	@Override
	public Optional<String> visit(LocalparamDeclaration localparamDeclaration) {
		return Optional.of(localparamDeclaration.getName());
	}

	@Override
	public Optional<String> visit(NetDeclaration netDeclaration) {
		return Optional.of(netDeclaration.getName());
	}

	@Override
	public Optional<String> visit(ParameterDeclaration parameterDeclaration) {
		return Optional.of(parameterDeclaration.getName());
	}

	@Override
	public Optional<String> visit(RegDeclaration regDeclaration) {
		return Optional.of(regDeclaration.getName());
	}

	@Override
	public Optional<String> visit(ContinuousAssign continuousAssign) {
		return Optional.empty();
	}

	@Override
	public Optional<String> visit(ModuleInstantiation moduleInstantiation) {
		return Optional.of(moduleInstantiation.getInstanceName());
	}

	@Override
	public Optional<String> visit(IfGenerateConstruct ifGenerateConstruct) {
		return Optional.empty();
	}

	@Override
	public Optional<String> visit(CaseGenerateConstruct caseGenerateConstruct) {
		return Optional.empty();
	}

	@Override
	public Optional<String> visit(LoopGenerateConstruct loopGenerateConstruct) {
		return Optional.empty();
	}
}
