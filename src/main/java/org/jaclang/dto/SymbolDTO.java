package org.jaclang.dto;

import java.util.ArrayList;
import java.util.List;

public class SymbolDTO
{
	public String name;
	public String kind;
	public String access;
	public int declLine;
	public List<Integer> additionalDeclLines = new ArrayList<>();
	public List<Integer> useLines = new ArrayList<>();
	public String memberScope;
}
