package velab.transform;

import velab.InternalCompilerError;
import velab.analyze.Evaluator;
import velab.analyze.ModuleInterface;
import velab.model.verilog.*;
import velab.scope.Scope;
import velab.util.SourceLocation;
import velab.util.TransactionalMap;

import java.util.*;

/**
 * Expands instantiations and generate constructs.
 *
 * An instantiation expands to a copy of its module with every parameter override folded to a literal. Generate
 * constructs expand to copies of the blocks they select; a loop produces one block per iteration, labelled
 * {@code label[i]}, with the loop variable bound by a localparam at the top of the block. Blocks without a label
 * are named {@code genblkN}, N being the 1-based position of their construct among the generate constructs of
 * the enclosing scope.
 *
 * Expansion results are attached to the node that was expanded, and expanding an already expanded node returns
 * what is attached. Nothing here reports errors: whatever the checker would have rejected is skipped (missing
 * modules) or treated as false (non-constant conditions).
 */
public class Elaborator {

	private static final String DEFAULT_LABEL_PREFIX = "genblk";

	private final TransactionalMap<Identifier, ModuleDeclaration> declarations;
	private final Evaluator evaluator;
	private final int maxLoopIterations;

	public Elaborator(TransactionalMap<Identifier, ModuleDeclaration> declarations, Evaluator evaluator,
	                  int maxLoopIterations) {
		this.declarations = declarations;
		this.evaluator = evaluator;
		this.maxLoopIterations = maxLoopIterations;
	}

	public Optional<ModuleDeclaration> elaborate(ModuleInstantiation mi, Scope scope) {
		if (mi.getInstance().isPresent()) {
			return mi.getInstance();
		}
		Optional<ModuleDeclaration> template = declarations.find(mi.getModuleId());
		if (!template.isPresent()) {
			return Optional.empty();
		}
		ModuleDeclaration instance = template.get().copy();
		ModuleInterface iface = new ModuleInterface(instance);
		List<ArgAssign> overrides = mi.getParameters();
		for (int i = 0; i < overrides.size(); ++i) {
			ArgAssign override = overrides.get(i);
			Optional<ParameterDeclaration> parameter = iface.parameterFor(override, i);
			Optional<Long> value = evaluator.evaluate(override.getValue(), scope);
			if (!parameter.isPresent() || !value.isPresent()) {
				continue;
			}
			ParameterDeclaration old = parameter.get();
			int index = indexOf(instance.getItems(), old);
			instance.getItems().set(index, new ParameterDeclaration(
					old.getLocation(), old.getName(), new NumberLiteral(override.getLocation(), value.get())));
		}
		mi.setInstance(instance);
		return Optional.of(instance);
	}

	public List<GenerateBlock> elaborate(GenerateConstruct construct, Scope scope) {
		if (construct.isElaborated()) {
			return construct.getGenerated();
		}
		List<GenerateBlock> generated = construct.accept(new GenerateExpansionVisitor(construct, scope));
		construct.setGenerated(generated);
		return construct.getGenerated();
	}

	private static int indexOf(List<ModuleItem> items, ModuleItem item) {
		for (int i = 0; i < items.size(); ++i) {
			if (items.get(i) == item) {
				return i;
			}
		}
		throw new InternalCompilerError("parameter is not an item of its own module");
	}

	private static String defaultLabel(GenerateConstruct construct, Scope scope) {
		List<ModuleItem> items;
		VerilogNode node = scope.getNode().orElseThrow(() -> new InternalCompilerError(
				"generate construct expanded outside of any module body"));
		if (node instanceof ModuleDeclaration) {
			items = ((ModuleDeclaration) node).getItems();
		} else if (node instanceof GenerateBlock) {
			items = ((GenerateBlock) node).getItems();
		} else {
			throw new InternalCompilerError("not a scope node: " + node.getClass().getSimpleName());
		}
		int position = 0;
		for (ModuleItem item : items) {
			if (item instanceof GenerateConstruct) {
				++position;
				if (item == construct) {
					return DEFAULT_LABEL_PREFIX + position;
				}
			}
		}
		throw new InternalCompilerError("generate construct is not an item of its scope " + scope);
	}

	private class GenerateExpansionVisitor extends GenerateConstructVisitor<List<GenerateBlock>, RuntimeException> {
		private final GenerateConstruct construct;
		private final Scope scope;

		GenerateExpansionVisitor(GenerateConstruct construct, Scope scope) {
			this.construct = construct;
			this.scope = scope;
		}

		private String labelOf(GenerateBlock block) {
			return block.getLabel().orElseGet(() -> defaultLabel(construct, scope));
		}

		private List<GenerateBlock> select(GenerateBlock block) {
			return Collections.singletonList(block.relabel(labelOf(block)));
		}

		@Override
		public List<GenerateBlock> visit(IfGenerateConstruct ifGenerateConstruct) {
			boolean taken = evaluator.evaluate(ifGenerateConstruct.getCondition(), scope).map(v -> v != 0).orElse(false);
			if (taken) {
				return select(ifGenerateConstruct.getYes());
			}
			return ifGenerateConstruct.getNo()
					.map(this::select)
					.orElse(Collections.emptyList());
		}

		@Override
		public List<GenerateBlock> visit(CaseGenerateConstruct caseGenerateConstruct) {
			Optional<Long> subject = evaluator.evaluate(caseGenerateConstruct.getSubject(), scope);
			if (!subject.isPresent()) {
				return Collections.emptyList();
			}
			CaseGenerateItem fallback = null;
			for (CaseGenerateItem item : caseGenerateConstruct.getItems()) {
				if (item.isDefault()) {
					if (fallback == null) {
						fallback = item;
					}
					continue;
				}
				for (Expression match : item.getMatches()) {
					if (evaluator.evaluate(match, scope).equals(subject)) {
						return select(item.getBlock());
					}
				}
			}
			if (fallback != null) {
				return select(fallback.getBlock());
			}
			return Collections.emptyList();
		}

		@Override
		public List<GenerateBlock> visit(LoopGenerateConstruct loopGenerateConstruct) {
			String genvar = loopGenerateConstruct.getGenvar();
			GenerateBlock body = loopGenerateConstruct.getBody();
			String label = labelOf(body);
			List<GenerateBlock> unrolled = new ArrayList<>();

			Optional<Long> value = evaluator.evaluate(loopGenerateConstruct.getInit(), scope);
			Map<String, Long> bindings = new HashMap<>();
			while (value.isPresent() && unrolled.size() < maxLoopIterations) {
				long i = value.get();
				bindings.put(genvar, i);
				boolean more = evaluator.evaluate(loopGenerateConstruct.getCondition(), scope, bindings)
						.map(v -> v != 0).orElse(false);
				if (!more) {
					break;
				}
				GenerateBlock iteration = body.relabel(label + "[" + i + "]");
				iteration.getItems().add(0,
						new LocalparamDeclaration(body.getLocation(), genvar, new NumberLiteral(SourceLocation.unknown(), i)));
				unrolled.add(iteration);
				value = evaluator.evaluate(loopGenerateConstruct.getUpdate(), scope, bindings);
			}
			return unrolled;
		}
	}
}
