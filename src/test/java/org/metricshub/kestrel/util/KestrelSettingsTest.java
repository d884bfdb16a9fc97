package org.metricshub.kestrel.util;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Test;
import org.metricshub.kestrel.frontend.ast.SourcePos;
import org.metricshub.kestrel.frontend.ast.Span;

public class KestrelSettingsTest {

	@Test
	public void testDefaults() {
		KestrelSettings settings = new KestrelSettings();
		assertSame(System.out, settings.getOutputStream());
		assertEquals(KestrelSettings.DEFAULT_MAX_CALL_DEPTH, settings.getMaxCallDepth());
		assertEquals("outputStream = stdout\nmaxCallDepth = 256\n", settings.toDescriptionString());
	}

	@Test
	public void testWithOutputStream() {
		KestrelSettings settings = new KestrelSettings();
		settings.setMaxCallDepth(3);
		PrintStream out = new PrintStream(new ByteArrayOutputStream());
		KestrelSettings copy = settings.withOutputStream(out);
		assertSame(out, copy.getOutputStream());
		assertEquals(3, copy.getMaxCallDepth());
		assertSame("The original settings are left untouched", System.out, settings.getOutputStream());
		assertEquals("outputStream = custom\nmaxCallDepth = 3\n", copy.toDescriptionString());
	}

	@Test(expected = NullPointerException.class)
	public void testNullOutputStream() {
		new KestrelSettings().setOutputStream(null);
	}

	@Test
	public void testDiagnosticsFormat() {
		assertEquals("Line 3, col 14: Oops.", Diagnostics.format(new SourcePos(3, 14), "Oops."));
		assertEquals("Line 1, col 1: Oops.", Diagnostics.format(new Span(0, 0, SourcePos.START), "Oops."));
	}
}
