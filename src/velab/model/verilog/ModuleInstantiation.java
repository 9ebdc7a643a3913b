package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@code (* attrs *) Module #(parameters) name(ports);}
 *
 * Once elaborated, an instantiation holds the instance produced for it. While its parent is flattened, it also
 * holds the block that replaces it in the parent's body.
 */
public class ModuleInstantiation extends ModuleItem {

	private final Attributes attributes;
	private final Identifier moduleId;
	private final String instanceName;
	private final List<ArgAssign> parameters;
	private final List<ArgAssign> ports;

	private ModuleDeclaration instance;
	private GenerateBlock inlined;

	public ModuleInstantiation(SourceLocation location, Attributes attributes, Identifier moduleId,
	                           String instanceName, List<ArgAssign> parameters, List<ArgAssign> ports) {
		super(location);
		this.attributes = attributes;
		this.moduleId = moduleId;
		this.instanceName = instanceName;
		this.parameters = new ArrayList<>(parameters);
		this.ports = new ArrayList<>(ports);
		this.instance = null;
		this.inlined = null;
	}

	@Override
	public ModuleInstantiation copy() {
		return new ModuleInstantiation(
				getLocation(),
				attributes.copy(),
				moduleId,
				instanceName,
				parameters.stream().map(ArgAssign::copy).collect(Collectors.toList()),
				ports.stream().map(ArgAssign::copy).collect(Collectors.toList()));
	}

	public Attributes getAttributes() {
		return attributes;
	}

	public Identifier getModuleId() {
		return moduleId;
	}

	public String getInstanceName() {
		return instanceName;
	}

	public List<ArgAssign> getParameters() {
		return parameters;
	}

	public List<ArgAssign> getPorts() {
		return ports;
	}

	public Optional<ModuleDeclaration> getInstance() {
		return Optional.ofNullable(instance);
	}

	public void setInstance(ModuleDeclaration instance) {
		this.instance = instance;
	}

	public void clearInstance() {
		this.instance = null;
	}

	public Optional<GenerateBlock> getInlined() {
		return Optional.ofNullable(inlined);
	}

	public boolean isInlined() {
		return inlined != null;
	}

	public void setInlined(GenerateBlock inlined) {
		this.inlined = inlined;
	}

	public void clearInlined() {
		this.inlined = null;
	}

	@Override
	public <T, E extends Throwable> T accept(ModuleItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(attributes, moduleId, instanceName, parameters, ports);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		ModuleInstantiation that = (ModuleInstantiation) obj;
		return attributes.equals(that.attributes) &&
				moduleId.equals(that.moduleId) &&
				instanceName.equals(that.instanceName) &&
				parameters.equals(that.parameters) &&
				ports.equals(that.ports);
	}

}
