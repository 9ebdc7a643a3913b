package velab.analyze;

import velab.model.verilog.*;
import velab.scope.Scope;
import velab.scope.UID;

import java.util.*;

/**
 * Resolves references to the declarations they name.
 *
 * A reference is looked up from the innermost scope outwards. The remaining parts of a hierarchical name
 * descend through instantiations (into the attached instance, or into the inlined block while the parent is
 * flattened) and through labelled generated blocks.
 *
 * Successful resolutions are cached by reference UID. {@link #invalidate(VerilogNode)} drops every cached
 * resolution that starts or ends inside a discarded subtree.
 */
public class Resolver {

	private final Navigator navigator;
	private final Map<UID, Declaration> cache;

	public Resolver(Navigator navigator) {
		this.navigator = navigator;
		this.cache = new HashMap<>();
	}

	/**
	 * @param localOnly when set, hierarchical names are never resolved
	 */
	public Optional<Declaration> resolve(Reference reference, Scope scope, boolean localOnly) {
		Declaration cached = cache.get(reference.getUID());
		if (cached != null) {
			return Optional.of(cached);
		}
		Identifier id = reference.getId();
		if (id.isEmpty() || (localOnly && id.isHierarchical())) {
			return Optional.empty();
		}
		Optional<Declaration> resolved = resolveParts(id.getParts(), scope);
		resolved.ifPresent(decl -> cache.put(reference.getUID(), decl));
		return resolved;
	}

	/**
	 * Resolves a plain name without caching, for names that are not carried by a reference node such as the
	 * genvar of a loop generate construct.
	 */
	public Optional<Declaration> resolveName(String name, Scope scope) {
		return resolveParts(Collections.singletonList(name), scope);
	}

	/**
	 * The hierarchical name of something called {@code name} declared directly in {@code scope}.
	 */
	public Identifier getFullId(Scope scope, String name) {
		return scope.getPath().append(name);
	}

	public void invalidate(VerilogNode subtree) {
		Set<UID> discarded = new HashSet<>();
		for (VerilogNode node : Descendants.collect(subtree, true)) {
			discarded.add(node.getUID());
		}
		cache.entrySet().removeIf(e -> discarded.contains(e.getKey()) || discarded.contains(e.getValue().getUID()));
	}

	public boolean isCached(Reference reference) {
		return cache.containsKey(reference.getUID());
	}

	public Collection<Declaration> getCachedTargets() {
		return Collections.unmodifiableCollection(cache.values());
	}

	private Optional<Declaration> resolveParts(List<String> parts, Scope scope) {
		Optional<VerilogNode> head = lookupHead(parts.get(0), scope);
		if (!head.isPresent()) {
			return Optional.empty();
		}
		VerilogNode current = head.get();
		for (String part : parts.subList(1, parts.size())) {
			Optional<VerilogNode> inner = enter(current);
			if (!inner.isPresent()) {
				return Optional.empty();
			}
			Optional<VerilogNode> next = navigator.lookup(inner.get(), part);
			if (!next.isPresent()) {
				return Optional.empty();
			}
			current = next.get();
		}
		if (current instanceof Declaration) {
			return Optional.of((Declaration) current);
		}
		return Optional.empty();
	}

	private Optional<VerilogNode> lookupHead(String name, Scope scope) {
		for (Scope s = scope; s != null; s = s.getParent().orElse(null)) {
			if (!s.getNode().isPresent()) {
				continue;
			}
			Optional<VerilogNode> found = navigator.lookup(s.getNode().get(), name);
			if (found.isPresent()) {
				return found;
			}
		}
		return Optional.empty();
	}

	private static Optional<VerilogNode> enter(VerilogNode node) {
		if (node instanceof GenerateBlock) {
			return Optional.of(node);
		}
		if (node instanceof ModuleInstantiation) {
			ModuleInstantiation mi = (ModuleInstantiation) node;
			if (mi.isInlined()) {
				return mi.getInlined().map(b -> b);
			}
			return mi.getInstance().map(i -> i);
		}
		return Optional.empty();
	}
}
