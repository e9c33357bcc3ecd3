package tntc.model.tnt;

import tntc.util.SourceLocation;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Static helpers for building TNT ASTs by hand. Every node gets a fresh id from a counter
 * private to this class and an unknown source location.
 */
public class Builder {
	private Builder() {}

	private static final AtomicLong lastId = new AtomicLong(0);

	public static long nextId() {
		return lastId.incrementAndGet();
	}

	// modules and declarations

	public static TntModule module(String name, TntDeclaration... declarations) {
		return new TntModule(SourceLocation.unknown(), nextId(), name, new ArrayList<>(Arrays.asList(declarations)));
	}

	public static TntConstant constant(String name, TntType type) {
		return new TntConstant(SourceLocation.unknown(), nextId(), name, type);
	}

	public static TntVariable variable(String name, TntType type) {
		return new TntVariable(SourceLocation.unknown(), nextId(), name, type);
	}

	public static TntOperatorDefinition opdef(String name, TntExpression body) {
		return opdef(name, TntOperatorDefinition.Qualifier.DEF, body, null);
	}

	public static TntOperatorDefinition opdef(String name, TntOperatorDefinition.Qualifier qualifier,
	                                          TntExpression body, TntType typeAnnotation) {
		return new TntOperatorDefinition(SourceLocation.unknown(), nextId(), name, qualifier, body, typeAnnotation);
	}

	public static TntOperatorDefinition pureval(String name, TntExpression body, TntType typeAnnotation) {
		return opdef(name, TntOperatorDefinition.Qualifier.PUREVAL, body, typeAnnotation);
	}

	public static TntTypeDefinition typedef(String name, TntType type) {
		return new TntTypeDefinition(SourceLocation.unknown(), nextId(), name, type);
	}

	public static TntTypeDefinition uninterpreted(String name) {
		return typedef(name, null);
	}

	public static TntAssumption assume(String name, TntExpression assumption) {
		return new TntAssumption(SourceLocation.unknown(), nextId(), name, assumption);
	}

	public static TntImport importDef(String moduleName, String definitionName) {
		return new TntImport(SourceLocation.unknown(), nextId(), moduleName, definitionName);
	}

	public static TntImport importAll(String moduleName) {
		return importDef(moduleName, TntImport.WILDCARD);
	}

	public static TntInstance instance(String name, String protoName, TntInstance.Override... overrides) {
		return new TntInstance(SourceLocation.unknown(), nextId(), name, protoName, Arrays.asList(overrides));
	}

	public static TntInstance.Override override(String name, TntExpression expression) {
		return new TntInstance.Override(SourceLocation.unknown(), nextId(), name, expression);
	}

	public static TntModuleDefinition nested(TntModule module) {
		return new TntModuleDefinition(SourceLocation.unknown(), nextId(), module);
	}

	// expressions

	public static TntName name(String name) {
		return new TntName(SourceLocation.unknown(), nextId(), name);
	}

	public static TntInt num(long value) {
		return new TntInt(SourceLocation.unknown(), nextId(), BigInteger.valueOf(value));
	}

	public static TntBool bool(boolean value) {
		return new TntBool(SourceLocation.unknown(), nextId(), value);
	}

	public static TntStr str(String value) {
		return new TntStr(SourceLocation.unknown(), nextId(), value);
	}

	public static TntApp app(String opcode, TntExpression... args) {
		return new TntApp(SourceLocation.unknown(), nextId(), opcode, Arrays.asList(args));
	}

	public static List<String> params(String... names) {
		return Arrays.asList(names);
	}

	public static TntLambda lambda(List<String> params, TntExpression body) {
		List<TntParameter> parameters = new ArrayList<>();
		for (String param : params) {
			parameters.add(new TntParameter(SourceLocation.unknown(), nextId(), param));
		}
		return new TntLambda(SourceLocation.unknown(), nextId(), parameters, TntOperatorDefinition.Qualifier.DEF, body);
	}

	public static TntLet let(TntOperatorDefinition definition, TntExpression body) {
		return new TntLet(SourceLocation.unknown(), nextId(), definition, body);
	}

	// types

	public static TntPrimitiveType intType() {
		return new TntPrimitiveType(SourceLocation.unknown(), nextId(), TntPrimitiveType.Kind.INT);
	}

	public static TntPrimitiveType boolType() {
		return new TntPrimitiveType(SourceLocation.unknown(), nextId(), TntPrimitiveType.Kind.BOOL);
	}

	public static TntPrimitiveType strType() {
		return new TntPrimitiveType(SourceLocation.unknown(), nextId(), TntPrimitiveType.Kind.STR);
	}

	public static TntTypeVariable typeVar(String name) {
		return new TntTypeVariable(SourceLocation.unknown(), nextId(), name);
	}

	public static TntConstType constType(String name) {
		return new TntConstType(SourceLocation.unknown(), nextId(), name);
	}

	public static TntSetType setType(TntType elementType) {
		return new TntSetType(SourceLocation.unknown(), nextId(), elementType);
	}

	public static TntListType listType(TntType elementType) {
		return new TntListType(SourceLocation.unknown(), nextId(), elementType);
	}

	public static TntFunctionType funType(TntType argument, TntType result) {
		return new TntFunctionType(SourceLocation.unknown(), nextId(), argument, result);
	}

	public static TntOperatorType operType(List<TntType> arguments, TntType result) {
		return new TntOperatorType(SourceLocation.unknown(), nextId(), arguments, result);
	}

	public static Row.Field field(String name, TntType type) {
		return new Row.Field(name, type);
	}

	public static Row row(Row.Field... fields) {
		return new Row(Arrays.asList(fields), null);
	}

	public static TntTupleType tupleType(TntType... elementTypes) {
		List<Row.Field> fields = new ArrayList<>();
		for (int i = 0; i < elementTypes.length; i++) {
			fields.add(new Row.Field(Integer.toString(i), elementTypes[i]));
		}
		return new TntTupleType(SourceLocation.unknown(), nextId(), new Row(fields, null));
	}

	public static TntRecordType recordType(Row.Field... fields) {
		return new TntRecordType(SourceLocation.unknown(), nextId(), row(fields));
	}

	public static TntUnionType.Record unionRecord(String tagValue, Row.Field... fields) {
		return new TntUnionType.Record(tagValue, row(fields));
	}

	public static TntUnionType unionType(String tag, TntUnionType.Record... records) {
		return new TntUnionType(SourceLocation.unknown(), nextId(), tag, Arrays.asList(records));
	}

}
