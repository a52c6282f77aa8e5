/*
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.damvis;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summarizes a batch export: which frames made it into the video and why the
 * others were skipped.
 */
public class ExportReport {

	private final File output;
	private final List<Integer> exported = new ArrayList<>();
	private final Map<Integer, String> skipped = new LinkedHashMap<>();
	private boolean written;

	ExportReport(final File output) {
		this.output = output;
	}

	void addExported(final int frameIndex) {
		exported.add(frameIndex);
	}

	void addSkipped(final int frameIndex, final String reason) {
		skipped.put(frameIndex, reason);
	}

	void setWritten(final boolean written) {
		this.written = written;
	}

	/** @return the video file requested */
	public File getOutput() {
		return output;
	}

	/** @return whether the video file has been written */
	public boolean isWritten() {
		return written;
	}

	/** @return the indices of captured frames, in export order */
	public List<Integer> getExported() {
		return Collections.unmodifiableList(exported);
	}

	/** @return the indices of skipped frames mapped to the reason for skipping */
	public Map<Integer, String> getSkipped() {
		return Collections.unmodifiableMap(skipped);
	}

	public boolean isEmpty() {
		return exported.isEmpty();
	}

	@Override
	public String toString() {
		return "Export of " + output.getName() + ": " + exported.size() + " frame(s) exported, " + skipped.size()
				+ " skipped" + ((skipped.isEmpty()) ? "" : " " + skipped.keySet());
	}

}
