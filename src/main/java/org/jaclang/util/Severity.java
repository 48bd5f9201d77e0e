package org.jaclang.util;

public enum Severity
{
	ERROR, WARNING
}
