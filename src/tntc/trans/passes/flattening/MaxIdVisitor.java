package tntc.trans.passes.flattening;

import tntc.model.tnt.*;

import java.util.Collection;
import java.util.List;

/**
 * Finds the largest node id in a subtree, so fresh ids can be minted above every id the
 * parser handed out.
 */
public class MaxIdVisitor extends TntNodeVisitor<Long, RuntimeException> {

	public static long maxId(Collection<TntModule> modules) {
		MaxIdVisitor visitor = new MaxIdVisitor();
		long max = 0;
		for (TntModule module : modules) {
			max = Math.max(max, module.accept(visitor));
		}
		return max;
	}

	private long maxOf(long max, List<? extends TntNode> nodes) {
		for (TntNode node : nodes) {
			max = Math.max(max, node.accept(this));
		}
		return max;
	}

	private long maxOf(long max, TntNode node) {
		return node == null ? max : Math.max(max, node.accept(this));
	}

	private long maxOf(long max, Row row) {
		for (Row.Field field : row.getFields()) {
			max = maxOf(max, field.getFieldType());
		}
		return max;
	}

	@Override
	public Long visit(TntModule tntModule) throws RuntimeException {
		return maxOf(tntModule.getId(), tntModule.getDeclarations());
	}

	@Override
	public Long visit(TntDeclaration tntDeclaration) throws RuntimeException {
		long own = tntDeclaration.getId();
		return tntDeclaration.accept(new TntDeclarationVisitor<Long, RuntimeException>() {
			@Override
			public Long visit(TntConstant tntConstant) {
				return maxOf(own, tntConstant.getType());
			}

			@Override
			public Long visit(TntVariable tntVariable) {
				return maxOf(own, tntVariable.getType());
			}

			@Override
			public Long visit(TntOperatorDefinition tntOperatorDefinition) {
				return maxOf(maxOf(own, tntOperatorDefinition.getBody()), tntOperatorDefinition.getTypeAnnotation());
			}

			@Override
			public Long visit(TntTypeDefinition tntTypeDefinition) {
				return maxOf(own, tntTypeDefinition.getType());
			}

			@Override
			public Long visit(TntAssumption tntAssumption) {
				return maxOf(own, tntAssumption.getAssumption());
			}

			@Override
			public Long visit(TntImport tntImport) {
				return own;
			}

			@Override
			public Long visit(TntInstance tntInstance) {
				return maxOf(own, tntInstance.getOverrides());
			}

			@Override
			public Long visit(TntModuleDefinition tntModuleDefinition) {
				return maxOf(own, tntModuleDefinition.getModule());
			}
		});
	}

	@Override
	public Long visit(TntExpression tntExpression) throws RuntimeException {
		long own = tntExpression.getId();
		return tntExpression.accept(new TntExpressionVisitor<Long, RuntimeException>() {
			@Override
			public Long visit(TntName tntName) {
				return own;
			}

			@Override
			public Long visit(TntBool tntBool) {
				return own;
			}

			@Override
			public Long visit(TntInt tntInt) {
				return own;
			}

			@Override
			public Long visit(TntStr tntStr) {
				return own;
			}

			@Override
			public Long visit(TntApp tntApp) {
				return maxOf(own, tntApp.getArgs());
			}

			@Override
			public Long visit(TntLambda tntLambda) {
				return maxOf(maxOf(own, tntLambda.getParams()), tntLambda.getBody());
			}

			@Override
			public Long visit(TntLet tntLet) {
				return maxOf(maxOf(own, tntLet.getDefinition()), tntLet.getBody());
			}
		});
	}

	@Override
	public Long visit(TntType tntType) throws RuntimeException {
		long own = tntType.getId();
		return tntType.accept(new TntTypeVisitor<Long, RuntimeException>() {
			@Override
			public Long visit(TntPrimitiveType tntPrimitiveType) {
				return own;
			}

			@Override
			public Long visit(TntTypeVariable tntTypeVariable) {
				return own;
			}

			@Override
			public Long visit(TntConstType tntConstType) {
				return own;
			}

			@Override
			public Long visit(TntSetType tntSetType) {
				return maxOf(own, tntSetType.getElementType());
			}

			@Override
			public Long visit(TntListType tntListType) {
				return maxOf(own, tntListType.getElementType());
			}

			@Override
			public Long visit(TntFunctionType tntFunctionType) {
				return maxOf(maxOf(own, tntFunctionType.getArgument()), tntFunctionType.getResult());
			}

			@Override
			public Long visit(TntOperatorType tntOperatorType) {
				return maxOf(maxOf(own, tntOperatorType.getArguments()), tntOperatorType.getResult());
			}

			@Override
			public Long visit(TntTupleType tntTupleType) {
				return maxOf(own, tntTupleType.getFields());
			}

			@Override
			public Long visit(TntRecordType tntRecordType) {
				return maxOf(own, tntRecordType.getFields());
			}

			@Override
			public Long visit(TntUnionType tntUnionType) {
				long max = own;
				for (TntUnionType.Record record : tntUnionType.getRecords()) {
					max = maxOf(max, record.getFields());
				}
				return max;
			}
		});
	}

	@Override
	public Long visit(TntParameter tntParameter) throws RuntimeException {
		return tntParameter.getId();
	}

	@Override
	public Long visit(TntInstance.Override override) throws RuntimeException {
		return maxOf(override.getId(), override.getExpression());
	}
}
