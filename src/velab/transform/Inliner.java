package velab.transform;

import velab.analyze.ModuleInterface;
import velab.analyze.References;
import velab.model.verilog.*;
import velab.util.SourceLocation;

import java.util.*;

/**
 * Flattens one level of the instance hierarchy.
 *
 * Inlining an instantiation attaches to it a block labelled with the instance name. The block declares a net
 * for every port, connects those nets to the instantiation's bindings with continuous assignments, and holds the
 * child's remaining items. The child's items are shared with the child instance, not copied, so outlining only
 * has to detach the block again.
 */
public class Inliner {

	public static final String STD_ATTRIBUTE = "__std";
	public static final String NO_INLINE_ATTRIBUTE = "__no_inline";

	public boolean canInline(ModuleDeclaration instance) {
		Attributes attributes = instance.getAttributes();
		return !attributes.find(STD_ATTRIBUTE).isPresent() && !attributes.find(NO_INLINE_ATTRIBUTE).isPresent();
	}

	/**
	 * Whether this particular instantiation can be replaced by its instance's body: the instance must be
	 * elaborated and inlinable, outputs must be bound to plain names, and no name used by a binding may be
	 * redeclared inside the child.
	 */
	public boolean canInline(ModuleInstantiation mi) {
		if (!mi.getInstance().isPresent() || !canInline(mi.getInstance().get())) {
			return false;
		}
		ModuleDeclaration child = mi.getInstance().get();
		ModuleInterface iface = new ModuleInterface(child);
		Set<String> childNames = declaredNames(child);
		List<ArgAssign> ports = mi.getPorts();
		for (int i = 0; i < ports.size(); ++i) {
			ArgAssign binding = ports.get(i);
			Optional<PortDeclaration> port = iface.portFor(binding, i);
			if (!port.isPresent()) {
				return false;
			}
			if (port.get().getDirection() == PortDeclaration.Direction.OUTPUT && !(binding.getValue() instanceof Reference)) {
				return false;
			}
			for (Reference reference : References.in(binding.getValue())) {
				if (childNames.contains(reference.getId().getHead())) {
					return false;
				}
			}
		}
		return true;
	}

	/**
	 * Inlines every eligible instantiation in the instance body, including those in generated blocks.
	 *
	 * @return the number of instantiations inlined
	 */
	public int inlineSource(ModuleDeclaration instance) {
		int count = 0;
		for (ModuleInstantiation mi : instantiations(instance.getItems())) {
			if (mi.isInlined() || !canInline(mi)) {
				continue;
			}
			mi.setInlined(buildBlock(mi));
			++count;
		}
		return count;
	}

	/**
	 * Detaches every inlined block in the instance body.
	 *
	 * @return the detached blocks, so that whatever was derived from them can be dropped
	 */
	public List<GenerateBlock> outlineSource(ModuleDeclaration instance) {
		List<GenerateBlock> detached = new ArrayList<>();
		for (ModuleInstantiation mi : instantiations(instance.getItems())) {
			mi.getInlined().ifPresent(detached::add);
			mi.clearInlined();
		}
		return detached;
	}

	private GenerateBlock buildBlock(ModuleInstantiation mi) {
		ModuleDeclaration child = mi.getInstance().get();
		ModuleInterface iface = new ModuleInterface(child);
		Set<String> nonPortNames = new HashSet<>();
		for (ModuleItem item : child.getItems()) {
			if (item instanceof Declaration && !(item instanceof PortDeclaration)) {
				nonPortNames.add(((Declaration) item).getName());
			}
		}

		SourceLocation loc = mi.getLocation();
		List<ModuleItem> items = new ArrayList<>();
		for (PortDeclaration port : iface.getPorts()) {
			// "output q; reg q;" already declares q
			if (!nonPortNames.contains(port.getName())) {
				items.add(new NetDeclaration(port.getLocation(), port.getName(), null));
			}
		}
		List<ArgAssign> ports = mi.getPorts();
		for (int i = 0; i < ports.size(); ++i) {
			ArgAssign binding = ports.get(i);
			PortDeclaration port = iface.portFor(binding, i).get();
			Reference portRef = new Reference(binding.getLocation(), Identifier.of(port.getName()));
			if (port.getDirection() == PortDeclaration.Direction.INPUT) {
				items.add(new ContinuousAssign(loc, portRef, binding.getValue().copy()));
			} else {
				Reference target = (Reference) binding.getValue().copy();
				items.add(new ContinuousAssign(loc, target, portRef));
			}
		}
		for (ModuleItem item : child.getItems()) {
			if (!(item instanceof PortDeclaration)) {
				items.add(item);
			}
		}
		return new GenerateBlock(loc, mi.getInstanceName(), items);
	}

	private static Set<String> declaredNames(ModuleDeclaration child) {
		Set<String> names = new HashSet<>();
		for (ModuleItem item : child.getItems()) {
			if (item instanceof Declaration) {
				names.add(((Declaration) item).getName());
			} else if (item instanceof ModuleInstantiation) {
				names.add(((ModuleInstantiation) item).getInstanceName());
			}
		}
		return names;
	}

	private static List<ModuleInstantiation> instantiations(List<ModuleItem> items) {
		List<ModuleInstantiation> found = new ArrayList<>();
		collect(items, found);
		return found;
	}

	private static void collect(List<ModuleItem> items, List<ModuleInstantiation> found) {
		for (ModuleItem item : items) {
			if (item instanceof ModuleInstantiation) {
				found.add((ModuleInstantiation) item);
			} else if (item instanceof GenerateConstruct) {
				for (GenerateBlock block : ((GenerateConstruct) item).getGenerated()) {
					collect(block.getItems(), found);
				}
			}
		}
	}
}
