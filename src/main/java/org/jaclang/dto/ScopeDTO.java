package org.jaclang.dto;

import java.util.ArrayList;
import java.util.List;

public class ScopeDTO
{
	public String name;
	public String owner;
	public int line;
	public List<String> inherits = new ArrayList<>();
	public List<SymbolDTO> symbols = new ArrayList<>();
	public List<ScopeDTO> children = new ArrayList<>();
}
