package org.jaclang.parser;

import org.jaclang.ast.CommentToken;
import org.jaclang.ast.Name;
import org.jaclang.ast.declarations.Ability;
import org.jaclang.ast.declarations.ArchHas;
import org.jaclang.ast.declarations.Architype;
import org.jaclang.ast.declarations.HasVar;
import org.jaclang.ast.declarations.Import;
import org.jaclang.ast.declarations.JacModule;
import org.jaclang.ast.statements.Assignment;
import org.jaclang.util.DiagnosticKind;
import org.jaclang.util.ErrorHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JacSourceParserTest
{
	private ErrorHandler errorHandler;
	private JacSourceParser parser;

	@BeforeEach
	void setUp()
	{
		errorHandler = new ErrorHandler("main");
		parser = new JacSourceParser(errorHandler);
	}

	@Test
	void buildsArchitypeWithMembers()
	{
		JacModule module = parser.parse("""
				obj Point {
				    has x: int = 0, y: int = 0;
				    can norm() -> float {
				        return 0.0;
				    }
				}
				""");

		assertThat(module).isNotNull();
		assertThat(module.getName()).isEqualTo("main");
		assertThat(module.getBody()).hasSize(1);

		Architype point = (Architype) module.getBody().get(0);
		assertThat(point.getArchType()).isEqualTo(Architype.ArchType.OBJ);
		assertThat(point.getSymName()).isEqualTo("Point");
		assertThat(point.getLocation().firstLine()).isEqualTo(1);
		assertThat(point.getLocation().lastLine()).isEqualTo(6);

		List<HasVar> vars = point.findAll(HasVar.class);
		assertThat(vars).extracting(HasVar::getSymName).containsExactly("x", "y");
		assertThat(vars.get(0).getOwnerHas()).isInstanceOf(ArchHas.class);

		Ability norm = point.findAll(Ability.class).get(0);
		assertThat(norm.isMethod()).isTrue();
		assertThat(norm.getOwnerArch()).isSameAs(point);
		assertThat(norm.isForwardDecl()).isFalse();
	}

	@Test
	void syntaxErrorReturnsNullAndReportsDiagnostic()
	{
		JacModule module = parser.parse("obj A { has x int; }");

		assertThat(module).isNull();
		assertThat(errorHandler.has(DiagnosticKind.SYNTAX_ERROR)).isTrue();
		assertThat(errorHandler.hasErrors()).isTrue();
	}

	@Test
	void docstringIsKeptApartFromBody()
	{
		JacModule module = parser.parse("\"\"\"Module doc.\"\"\"\nglob x = 1;\n");

		assertThat(module.getDocstring()).isNotNull();
		assertThat(module.getDocstring().getValue()).isEqualTo("\"\"\"Module doc.\"\"\"");
		assertThat(module.getBody()).hasSize(1);
	}

	@Test
	void commentsAreAttachedWithInlineFlag()
	{
		JacModule module = parser.parse("""
				glob x = 1;  # the answer
				# about y
				glob y = 2;
				""");

		List<CommentToken> comments = module.findAll(CommentToken.class);
		assertThat(comments).extracting(CommentToken::getValue).containsExactly("# the answer", "# about y");
		assertThat(comments.get(0).isInline()).isTrue();
		assertThat(comments.get(1).isInline()).isFalse();
		assertThat(comments).allSatisfy(c -> assertThat(c.getParent()).isSameAs(module));
	}

	@Test
	void commentInsideStatementGoesToInnermostNode()
	{
		JacModule module = parser.parse("glob data = [1, # one\n    2];\n");

		CommentToken comment = module.findAll(CommentToken.class).get(0);
		assertThat(comment.getParent()).isNotSameAs(module);
		assertThat(comment.findParent(Assignment.class)).isPresent();
	}

	@Test
	void keywordEscapedNameResolvesToBareIdentifier()
	{
		JacModule module = parser.parse("glob <>obj = 1;\n");

		Name name = module.findAll(Name.class).get(0);
		assertThat(name.getValue()).isEqualTo("<>obj");
		assertThat(name.isKwesc()).isTrue();
		assertThat(name.getSymName()).isEqualTo("obj");
	}

	@Test
	void includeIsAnAbsorbImport()
	{
		JacModule module = parser.parse("include:jac base;\nimport:py from os.path { join, exists as ex }\n");

		List<Import> imports = module.findAll(Import.class);
		assertThat(imports).hasSize(2);
		assertThat(imports.get(0).isAbsorb()).isTrue();
		assertThat(imports.get(0).isJac()).isTrue();
		assertThat(imports.get(1).isAbsorb()).isFalse();
		assertThat(imports.get(1).isJac()).isFalse();
		assertThat(imports.get(1).getItems().getItems()).hasSize(2);
	}
}
