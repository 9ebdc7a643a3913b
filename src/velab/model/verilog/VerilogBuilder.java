package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static constructors for AST nodes at unknown source locations, meant to be imported statically.
 */
public class VerilogBuilder {
	private VerilogBuilder() {}

	public static ModuleDeclaration module(String name, ModuleItem... items) {
		return module(name, noAttrs(), items);
	}

	public static ModuleDeclaration module(String name, Attributes attributes, ModuleItem... items) {
		return new ModuleDeclaration(SourceLocation.unknown(), attributes, Identifier.of(name), Arrays.asList(items));
	}

	public static Attributes noAttrs() {
		return new Attributes(SourceLocation.unknown(), Collections.emptyList());
	}

	public static Attributes attrs(AttrSpec... specs) {
		return new Attributes(SourceLocation.unknown(), Arrays.asList(specs));
	}

	public static AttrSpec attr(String key) {
		return new AttrSpec(SourceLocation.unknown(), key, null);
	}

	public static AttrSpec attr(String key, Expression value) {
		return new AttrSpec(SourceLocation.unknown(), key, value);
	}

	public static PortDeclaration input(String name) {
		return new PortDeclaration(SourceLocation.unknown(), PortDeclaration.Direction.INPUT, name);
	}

	public static PortDeclaration output(String name) {
		return new PortDeclaration(SourceLocation.unknown(), PortDeclaration.Direction.OUTPUT, name);
	}

	public static NetDeclaration wire(String name) {
		return new NetDeclaration(SourceLocation.unknown(), name, null);
	}

	public static NetDeclaration wire(String name, Expression value) {
		return new NetDeclaration(SourceLocation.unknown(), name, value);
	}

	public static RegDeclaration reg(String name) {
		return new RegDeclaration(SourceLocation.unknown(), name, null);
	}

	public static RegDeclaration reg(String name, Expression value) {
		return new RegDeclaration(SourceLocation.unknown(), name, value);
	}

	public static IntegerDeclaration integer(String name, Expression value) {
		return new IntegerDeclaration(SourceLocation.unknown(), name, value);
	}

	public static GenvarDeclaration genvar(String name) {
		return new GenvarDeclaration(SourceLocation.unknown(), name);
	}

	public static ParameterDeclaration parameter(String name, Expression value) {
		return new ParameterDeclaration(SourceLocation.unknown(), name, value);
	}

	public static LocalparamDeclaration localparam(String name, Expression value) {
		return new LocalparamDeclaration(SourceLocation.unknown(), name, value);
	}

	public static ContinuousAssign assign(String lhs, Expression rhs) {
		return new ContinuousAssign(SourceLocation.unknown(), ref(lhs), rhs);
	}

	public static ModuleInstantiation instantiate(String module, String instance, ArgAssign... ports) {
		return instantiate(noAttrs(), module, instance, Collections.emptyList(), Arrays.asList(ports));
	}

	public static ModuleInstantiation instantiate(String module, String instance, List<ArgAssign> parameters,
	                                              List<ArgAssign> ports) {
		return instantiate(noAttrs(), module, instance, parameters, ports);
	}

	public static ModuleInstantiation instantiate(Attributes attributes, String module, String instance,
	                                              List<ArgAssign> parameters, List<ArgAssign> ports) {
		return new ModuleInstantiation(SourceLocation.unknown(), attributes, Identifier.of(module), instance,
				parameters, ports);
	}

	public static ArgAssign arg(Expression value) {
		return new ArgAssign(SourceLocation.unknown(), null, value);
	}

	public static ArgAssign arg(String name, Expression value) {
		return new ArgAssign(SourceLocation.unknown(), name, value);
	}

	public static List<ArgAssign> args(ArgAssign... args) {
		return Arrays.asList(args);
	}

	public static GenerateBlock block(ModuleItem... items) {
		return new GenerateBlock(SourceLocation.unknown(), null, Arrays.asList(items));
	}

	public static GenerateBlock block(String label, ModuleItem... items) {
		return new GenerateBlock(SourceLocation.unknown(), label, Arrays.asList(items));
	}

	public static IfGenerateConstruct ifGen(Expression condition, GenerateBlock yes) {
		return new IfGenerateConstruct(SourceLocation.unknown(), condition, yes, null);
	}

	public static IfGenerateConstruct ifGen(Expression condition, GenerateBlock yes, GenerateBlock no) {
		return new IfGenerateConstruct(SourceLocation.unknown(), condition, yes, no);
	}

	public static CaseGenerateConstruct caseGen(Expression subject, CaseGenerateItem... items) {
		return new CaseGenerateConstruct(SourceLocation.unknown(), subject, Arrays.asList(items));
	}

	public static CaseGenerateItem when(GenerateBlock block, Expression... matches) {
		return new CaseGenerateItem(SourceLocation.unknown(), new ArrayList<>(Arrays.asList(matches)), block);
	}

	public static CaseGenerateItem otherwise(GenerateBlock block) {
		return new CaseGenerateItem(SourceLocation.unknown(), new ArrayList<>(), block);
	}

	public static LoopGenerateConstruct loopGen(String genvar, Expression init, Expression condition,
	                                            Expression update, GenerateBlock body) {
		return new LoopGenerateConstruct(SourceLocation.unknown(), genvar, init, condition, update, body);
	}

	public static NumberLiteral num(long value) {
		return new NumberLiteral(SourceLocation.unknown(), value);
	}

	public static Reference ref(String dotted) {
		return new Reference(SourceLocation.unknown(), Identifier.of(dotted));
	}

	public static UnaryExpression unop(String operator, Expression operand) {
		return new UnaryExpression(SourceLocation.unknown(), operator, operand);
	}

	public static BinaryExpression binop(String operator, Expression lhs, Expression rhs) {
		return new BinaryExpression(SourceLocation.unknown(), operator, lhs, rhs);
	}

	public static ConditionalExpression ternary(Expression condition, Expression yes, Expression no) {
		return new ConditionalExpression(SourceLocation.unknown(), condition, yes, no);
	}
}
