package velab.analyze;

import velab.model.verilog.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The parameters and ports a module declares, in declaration order, and the matching of an instantiation's
 * bindings against them. Named bindings match by name; ordered bindings match by position.
 */
public class ModuleInterface {
	private final List<ParameterDeclaration> parameters;
	private final List<PortDeclaration> ports;

	public ModuleInterface(ModuleDeclaration module) {
		List<ParameterDeclaration> params = new ArrayList<>();
		List<PortDeclaration> portDecls = new ArrayList<>();
		for (ModuleItem item : module.getItems()) {
			if (item instanceof ParameterDeclaration) {
				params.add((ParameterDeclaration) item);
			} else if (item instanceof PortDeclaration) {
				portDecls.add((PortDeclaration) item);
			}
		}
		this.parameters = Collections.unmodifiableList(params);
		this.ports = Collections.unmodifiableList(portDecls);
	}

	public List<ParameterDeclaration> getParameters() {
		return parameters;
	}

	public List<PortDeclaration> getPorts() {
		return ports;
	}

	public Optional<ParameterDeclaration> parameterFor(ArgAssign binding, int position) {
		return match(parameters, binding, position);
	}

	public Optional<PortDeclaration> portFor(ArgAssign binding, int position) {
		return match(ports, binding, position);
	}

	private static <D extends Declaration> Optional<D> match(List<D> formals, ArgAssign binding, int position) {
		if (binding.isNamed()) {
			String name = binding.getName().get();
			return formals.stream().filter(d -> d.getName().equals(name)).findFirst();
		}
		if (position < formals.size()) {
			return Optional.of(formals.get(position));
		}
		return Optional.empty();
	}
}
