package org.jaclang.semantic;

import org.jaclang.ast.Name;
import org.jaclang.ast.declarations.TestBlock;
import org.jaclang.semantic.symbol.AccessModifier;
import org.jaclang.semantic.symbol.Scope;
import org.jaclang.semantic.symbol.SymbolKind;

import java.util.List;
import java.util.Set;

/**
 * Names that exist without a declaration in the module: the runtime's builtins and
 * the assertion helpers available inside {@code test} blocks.
 */
public class BuiltInNames
{
	/**
	 * Names a bare reference may use without being reported as unresolved.
	 */
	public static final Set<String> BUILTINS = Set.of(
			// Types
			"int", "float", "str", "bool", "bytes", "list", "tuple", "set", "dict", "type", "any", "object",
			"complex", "frozenset", "bytearray", "range", "slice",
			// Functions
			"abs", "all", "anext", "aiter", "ascii", "bin", "breakpoint", "callable", "chr", "classmethod", "compile",
			"delattr", "dir", "divmod", "enumerate", "eval", "exec", "filter", "format", "getattr", "globals",
			"hasattr", "hash", "help", "hex", "id", "input", "isinstance", "issubclass", "iter", "len", "locals",
			"map", "max", "memoryview", "min", "next", "oct", "open", "ord", "pow", "print", "property", "repr",
			"reversed", "round", "setattr", "sorted", "staticmethod", "sum", "super", "vars", "zip", "__import__",
			// Exceptions
			"BaseException", "Exception", "ArithmeticError", "AssertionError", "AttributeError", "ImportError",
			"IndexError", "KeyError", "LookupError", "NameError", "NotImplementedError", "OSError", "RuntimeError",
			"StopIteration", "TypeError", "ValueError", "ZeroDivisionError", "KeyboardInterrupt", "NotImplemented",
			// Module attributes
			"__name__", "__file__", "__doc__",
			// Walker context
			"self", "here", "root", "visitor", "_");

	/**
	 * Assertion helpers declared in every test scope.
	 */
	public static final List<String> TEST_HELPERS = List.of(
			"assertAlmostEqual", "assertCountEqual", "assertDictEqual", "assertEqual", "assertFalse",
			"assertGreater", "assertGreaterEqual", "assertIn", "assertIs", "assertIsInstance", "assertIsNone",
			"assertIsNot", "assertIsNotNone", "assertLess", "assertLessEqual", "assertListEqual", "assertLogs",
			"assertMultiLineEqual", "assertNoLogs", "assertNotAlmostEqual", "assertNotEqual", "assertNotIn",
			"assertNotIsInstance", "assertNotRegex", "assertRaises", "assertRaisesRegex", "assertRegex",
			"assertSequenceEqual", "assertSetEqual", "assertTrue", "assertTupleEqual", "assertWarns",
			"assertWarnsRegex");

	public static boolean isBuiltin(String name)
	{
		return BUILTINS.contains(name);
	}

	/**
	 * Declares every test helper in the scope of a test block.
	 *
	 * @param test  The test whose scope is being populated.
	 * @param scope The scope opened for the test.
	 */
	public static void defineTestHelpers(TestBlock test, Scope scope)
	{
		for (String helper : TEST_HELPERS)
		{
			Name stub = Name.stub(test, helper);
			stub.setScope(scope);
			scope.define(stub, SymbolKind.BUILTIN, AccessModifier.PUBLIC, null);
		}
	}
}
