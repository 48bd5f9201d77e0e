package org.jaclang.util;

import org.jaclang.ast.AstSymbolNode;
import org.jaclang.dto.ScopeDTO;
import org.jaclang.dto.SymbolDTO;
import org.jaclang.semantic.symbol.Scope;
import org.jaclang.semantic.symbol.Symbol;

import java.util.List;

public class SymbolDTOConverter
{
	public static ScopeDTO toScope(Scope scope)
	{
		ScopeDTO dto = new ScopeDTO();
		dto.name = scope.getName();
		dto.owner = scope.getOwner().getClass().getSimpleName();
		dto.line = scope.getOwner().getLocation().firstLine();

		for (Scope base : scope.getInherited())
		{
			dto.inherits.add(base.getName());
		}
		scope.getSymbols().values().forEach(symbol -> dto.symbols.add(symbolToDTO(symbol)));
		for (Scope child : scope.getChildren())
		{
			dto.children.add(toScope(child));
		}
		return dto;
	}

	private static SymbolDTO symbolToDTO(Symbol symbol)
	{
		SymbolDTO dto = new SymbolDTO();
		dto.name = symbol.getName();
		dto.kind = symbol.getKind().name();
		dto.access = symbol.getAccess().name();
		dto.declLine = symbol.getDeclarationLine();
		dto.additionalDeclLines.addAll(lines(symbol.getAdditionalDecls()));
		dto.useLines.addAll(lines(symbol.getUses()));
		if (symbol.getMemberScope() != null)
		{
			dto.memberScope = symbol.getMemberScope().getName();
		}
		return dto;
	}

	private static List<Integer> lines(List<AstSymbolNode> nodes)
	{
		return nodes.stream()
				.map(node -> node.getNameSpec().getLocation().firstLine())
				.toList();
	}
}
