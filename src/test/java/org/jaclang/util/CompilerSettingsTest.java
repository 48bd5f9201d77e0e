package org.jaclang.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class CompilerSettingsTest
{
	@AfterEach
	void clearOverrides()
	{
		System.clearProperty("jac.max_line_length");
		System.clearProperty("jac.debug");
	}

	@Test
	void defaultsApplyWithoutProperties()
	{
		CompilerSettings settings = new CompilerSettings(new Properties());

		assertThat(settings.getMaxLineLength()).isEqualTo(160);
		assertThat(settings.getWrapWidth()).isEqualTo(80);
		assertThat(settings.getIndentSize()).isEqualTo(4);
		assertThat(settings.isDebug()).isFalse();
	}

	@Test
	void propertiesOverrideDefaults()
	{
		Properties props = new Properties();
		props.setProperty("max_line_length", "100");
		props.setProperty("indent_size", "2");

		CompilerSettings settings = new CompilerSettings(props);

		assertThat(settings.getWrapWidth()).isEqualTo(50);
		assertThat(settings.getIndentSize()).isEqualTo(2);
	}

	@Test
	void systemPropertyWinsOverFile()
	{
		Properties props = new Properties();
		props.setProperty("max_line_length", "100");
		System.setProperty("jac.max_line_length", " 120 ");
		System.setProperty("jac.debug", "true");

		CompilerSettings settings = new CompilerSettings(props);

		assertThat(settings.getMaxLineLength()).isEqualTo(120);
		assertThat(settings.isDebug()).isTrue();
	}

	@Test
	void loadReadsClasspathResource()
	{
		CompilerSettings settings = CompilerSettings.load();

		assertThat(settings.getMaxLineLength()).isEqualTo(160);
		assertThat(settings.getIndentSize()).isEqualTo(4);
	}
}
