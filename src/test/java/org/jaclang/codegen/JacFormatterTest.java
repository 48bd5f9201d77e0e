package org.jaclang.codegen;

import org.jaclang.ast.declarations.JacModule;
import org.jaclang.ast.declarations.Architype;
import org.jaclang.parser.JacSourceParser;
import org.jaclang.util.CompilerSettings;
import org.jaclang.util.ErrorHandler;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class JacFormatterTest
{
	private static final String SAMPLE = """
			\"""Sample module.\"""

			import:py os;
			import:py from os.path { join, exists as ex }

			glob:priv counter = 0, limit: int = 10;

			obj Point {
			    has x: int = 0, y: int = 0;
			    static has count: int = 0;

			    can norm() -> float {
			        return (self.x ** 2 + self.y ** 2) ** 0.5;
			    }

			    can shift(dx: int, dy: int = 0) {
			        self.x += dx;
			        self.y += dy;
			    }
			}

			enum Color {
			    RED = 1,
			    GREEN = 2
			}

			walker Visitor {
			    can start with entry {
			        visit [-->];
			    }
			}

			can helper(*args, **kwargs) -> list {
			    result = [a for a in args if a];
			    return result;
			}

			with entry {
			    p = Point(x=1, y=2);
			    for i = 0 to i < 3 by i += 1 {
			        p.shift(i);
			    }
			    for k, v in {"a": 1}.items() {
			        print(k, v);
			    }
			    try {
			        risky = 1 / 0;
			    } except ZeroDivisionError as e {
			        print(e);
			    } finally {
			        print("done");
			    }
			    match p.x {
			        case 1 | 2:
			            print("small");
			        case _:
			            print("other");
			    }
			    while counter < limit and not False {
			        counter += 1;
			        if counter == 5 {
			            break;
			        } elif counter > 8 {
			            continue;
			        } else {
			            skip;
			        }
			    }
			}

			test point_norm {
			    assertEqual(Point(x=3, y=4).norm(), 5.0);
			}
			""";

	private final JacFormatter formatter = new JacFormatter(new CompilerSettings(new Properties()));

	private String format(String source)
	{
		JacModule module = new JacSourceParser(new ErrorHandler("test")).parse(source);
		assertThat(module).as("parse result of:%n%s", source).isNotNull();
		return formatter.format(module);
	}

	@Test
	void canonicalSourceIsLeftUnchanged()
	{
		assertThat(format(SAMPLE)).isEqualTo(SAMPLE);
	}

	@Test
	void formattingIsIdempotent()
	{
		String messy = """
				obj   A :B,C:{has x:int=5,y:str;can get_x()->int{return self.x;}}
				glob data = [1, # one
				    2];



				with entry{if a>1{b=2;}else{b=3;}  # trailing
				}
				""";

		String once = format(messy);

		assertThat(format(once)).isEqualTo(once);
	}

	@Test
	void reindentsArchitype()
	{
		String formatted = format("obj A :B,C:{has x:int=5,y:str;can get_x()->int{return self.x;}}");

		assertThat(formatted).isEqualTo("""
				obj A :B, C: {
				    has x: int = 5, y: str;

				    can get_x() -> int {
				        return self.x;
				    }
				}
				""");
	}

	@Test
	void emptyModuleFormatsToNothing()
	{
		assertThat(format("")).isEmpty();
		assertThat(format("# only a comment\n")).isEqualTo("# only a comment\n");
	}

	@Test
	void emptyBlockStaysOnOneLine()
	{
		assertThat(format("obj A {\n}\nwith entry {\n\n}\n")).isEqualTo("obj A {}\nwith entry {}\n");
	}

	@Test
	void blankLineRunsCollapseToOne()
	{
		assertThat(format("glob a = 1;\n\n\n\nglob b = 2;\n")).isEqualTo("glob a = 1;\n\nglob b = 2;\n");
		assertThat(format("glob a = 1;\nglob b = 2;\n")).isEqualTo("glob a = 1;\nglob b = 2;\n");
	}

	@Test
	void docstringIsFollowedByBlankLine()
	{
		assertThat(format("\"\"\"Module doc.\"\"\"\nglob x = 1;\n")).isEqualTo("\"\"\"Module doc.\"\"\"\n\nglob x = 1;\n");
	}

	@Test
	void inlineCommentStaysOnItsLine()
	{
		assertThat(format("glob x = 1;    # the answer\n")).isEqualTo("glob x = 1; # the answer\n");
	}

	@Test
	void standaloneCommentsKeepTheirLines()
	{
		String source = """
				# header

				glob x = 1;
				# about y
				glob y = 2;
				""";

		assertThat(format(source)).isEqualTo(source);
	}

	@Test
	void commentInsideBlockKeepsBlankLineBefore()
	{
		String source = """
				with entry {
				    a = 1;

				    # second part
				    b = 2;
				}
				""";

		assertThat(format(source)).isEqualTo(source);
	}

	@Test
	void commentInsideExpressionMovesAfterStatement()
	{
		assertThat(format("glob data = [1, # one\n    2];\n")).isEqualTo("glob data = [1, 2]; # one\n");
	}

	@Test
	void longCallArgumentsWrapOnePerLine()
	{
		String source = "with entry { print(\"aaaaaaaaaaaaaaaaaaaaaaaaaaaaaa\", \"bbbbbbbbbbbbbbbbbbbbbbbbbbbbbb\", \"cccccccccccccccccccc\"); }";

		assertThat(format(source)).isEqualTo("""
				with entry {
				    print(
				        "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaa",
				        "bbbbbbbbbbbbbbbbbbbbbbbbbbbbbb",
				        "cccccccccccccccccccc",
				    );
				}
				""");
	}

	@Test
	void longListWrapsOnePerLine()
	{
		String source = "glob items = [\"aaaaaaaaaaaaaaaaaaaaaaaaa\", \"bbbbbbbbbbbbbbbbbbbbbbbbb\", \"ccccccccccccccccccccccccc\"];";

		assertThat(format(source)).isEqualTo("""
				glob items = [
				    "aaaaaaaaaaaaaaaaaaaaaaaaa",
				    "bbbbbbbbbbbbbbbbbbbbbbbbb",
				    "ccccccccccccccccccccccccc",
				];
				""");
	}

	@Test
	void shortListStaysOnOneLine()
	{
		assertThat(format("glob items = [\n    1,\n    2,\n];\n")).isEqualTo("glob items = [1, 2];\n");
	}

	@Test
	void longImportItemListWraps()
	{
		String source = "import:py from some.module { first_long_item_name, second_long_item_name, third_long_item_name,"
				+ " fourth_long_item_name, last_item }";

		assertThat(format(source)).isEqualTo("""
				import:py from some.module {
				    first_long_item_name,
				    second_long_item_name,
				    third_long_item_name,
				    fourth_long_item_name,
				    last_item,
				}
				""");
	}

	@Test
	void longBoolChainBreaksBeforeOperators()
	{
		String source = "with entry { if first_condition_is_satisfied_a and first_condition_is_satisfied_b"
				+ " and first_condition_is_satisfied_c { x = 1; } }";

		assertThat(format(source)).isEqualTo("""
				with entry {
				    if first_condition_is_satisfied_a
				        and first_condition_is_satisfied_b
				        and first_condition_is_satisfied_c {
				        x = 1;
				    }
				}
				""");
	}

	@Test
	void veryLongArithmeticAssignmentBreaksBeforeOperators()
	{
		StringBuilder value = new StringBuilder("value_number_001");
		for (int i = 2; i <= 10; i++)
		{
			value.append(" + value_number_0").append(String.format("%02d", i));
		}
		String source = "with entry { total = " + value + "; }";

		String formatted = format(source);

		assertThat(formatted).startsWith("with entry {\n    total = value_number_001\n        + value_number_002\n");
		assertThat(formatted).endsWith("        + value_number_010;\n}\n");
		assertThat(formatted.lines()).hasSize(12);
	}

	@Test
	void ifChainsKeepElseOnClosingBraceLine()
	{
		String source = "with entry { if x > 1 { y = 2; } elif x < 0 { y = 3; } else { y = 4; } }";

		assertThat(format(source)).isEqualTo("""
				with entry {
				    if x > 1 {
				        y = 2;
				    } elif x < 0 {
				        y = 3;
				    } else {
				        y = 4;
				    }
				}
				""");
	}

	@Test
	void enumMembersGoOnePerLine()
	{
		assertThat(format("enum Color { RED = 1, GREEN = 2, BLUE, }")).isEqualTo("""
				enum Color {
				    RED = 1,
				    GREEN = 2,
				    BLUE
				}
				""");
	}

	@Test
	void singleElementTupleKeepsTrailingComma()
	{
		assertThat(format("glob t = (a ,);\n")).isEqualTo("glob t = (a,);\n");
	}

	@Test
	void canonicalKeywordForms()
	{
		assertThat(format("include:jac   base ;")).isEqualTo("include:jac base;\n");
		assertThat(format("with entry { :g: x; f = with x: int can x*2; }")).isEqualTo("""
				with entry {
				    :g: x;
				    f = with x: int can x * 2;
				}
				""");
		assertThat(format("test   adds_up {assertEqual(1+1,2);}")).isEqualTo("""
				test adds_up {
				    assertEqual(1 + 1, 2);
				}
				""");
	}

	@Test
	void multiLineStringStatementIsSplitPerLine()
	{
		String source = "with entry {\n    \"\"\"first\nsecond\"\"\";\n}\n";

		String formatted = format(source);

		assertThat(formatted).isEqualTo("with entry {\n    \"\"\"first\\n\"\"\"\n    \"\"\"second\"\"\";\n}\n");
		assertThat(format(formatted)).isEqualTo(formatted);
	}

	@Test
	void rawMultiLineStringIsNotSplit()
	{
		String source = "with entry {\n    r\"\"\"first\nsecond\"\"\";\n}\n";

		String formatted = format(source);

		assertThat(formatted).isEqualTo("with entry {\n    r\"\"\"first\n    second\"\"\";\n}\n");
		assertThat(format(formatted)).isEqualTo(formatted);
	}

	@Test
	void continuationLinesOfMultiLineStringAreStripped()
	{
		assertThat(format("glob s = \"\"\"one\n        two\"\"\";\n")).isEqualTo("glob s = \"\"\"one\ntwo\"\"\";\n");
	}

	@Test
	void everyNodeKeepsItsText()
	{
		JacModule module = new JacSourceParser(new ErrorHandler("test")).parse("obj A {}\n");

		formatter.format(module);

		Architype arch = module.findAll(Architype.class).get(0);
		assertThat(arch.getGeneratedText()).isEqualTo("obj A {}");
		assertThat(module.getGeneratedText()).isEqualTo("obj A {}\n");
	}

	@Test
	void narrowerWidthWrapsEarlier()
	{
		Properties props = new Properties();
		props.setProperty("max_line_length", "16");
		JacFormatter narrow = new JacFormatter(new CompilerSettings(props));
		JacModule module = new JacSourceParser(new ErrorHandler("test")).parse("glob xs = [1, 2, 3];\n");

		assertThat(narrow.format(module)).isEqualTo("glob xs = [\n    1,\n    2,\n    3,\n];\n");
	}

	@Test
	void keyCountsTowardsWidthOfItsValue()
	{
		String source = "glob table = {\"key_number_one\": [1111111111, 2222222222, 3333333333, 4444444444, 5555555555, 6]};";

		String formatted = format(source);

		assertThat(formatted).isEqualTo("""
				glob table = {
				    "key_number_one": [
				        1111111111,
				        2222222222,
				        3333333333,
				        4444444444,
				        5555555555,
				        6,
				    ],
				};
				""");
		assertThat(format(formatted)).isEqualTo(formatted);
	}

	@Test
	void keywordArgumentCountsTowardsWidthOfItsValue()
	{
		String source = "with entry { draw(points_to_draw_now=[1111111111, 2222222222, 3333333333, 4444444444, 5555555555, 6]); }";

		assertThat(format(source)).isEqualTo("""
				with entry {
				    draw(
				        points_to_draw_now=[
				            1111111111,
				            2222222222,
				            3333333333,
				            4444444444,
				            5555555555,
				            6,
				        ],
				    );
				}
				""");
	}

	@Test
	void caseHeaderCommentsStayAtTopOfCase()
	{
		String source = """
				with entry {
				    match x {
				        case 1: # one
				            print(1);
				        case _:
				            # anything else
				            print(2);
				    }
				}
				""";

		assertThat(format(source)).isEqualTo(source);
	}
}
