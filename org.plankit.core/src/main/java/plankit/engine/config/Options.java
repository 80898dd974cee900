/* 
 * Plankit -- Copyright (c) 2024-present, the Plankit authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package plankit.engine.config;

/**
 * Stores the options shared by the compilers: the reporter they send
 * messages to and the handling of the feature checks that precede a
 * compilation.
 * 
 * The default options use a reporter that ignores every message, perform
 * the feature checks and fail on a problem whose features are not
 * supported.
 */
public final class Options implements Cloneable {

	private Reporter reporter = new AbstractReporter() {};
	private boolean skipChecks = false;
	private boolean errorOnFailedChecks = true;

	public Reporter reporter() {
		return reporter;
	}

	/**
	 * @throws NullPointerException
	 *             reporter = null
	 */
	public void setReporter(Reporter reporter) {
		if (reporter == null)
			throw new NullPointerException();
		this.reporter = reporter;
	}

	/** @return whether the problem features are left unchecked before compiling. */
	public boolean skipChecks() {
		return skipChecks;
	}

	public void setSkipChecks(boolean skipChecks) {
		this.skipChecks = skipChecks;
	}

	/**
	 * @return whether a problem with unsupported features is an error, rather
	 *         than a warning sent to the reporter.
	 */
	public boolean errorOnFailedChecks() {
		return errorOnFailedChecks;
	}

	public void setErrorOnFailedChecks(boolean errorOnFailedChecks) {
		this.errorOnFailedChecks = errorOnFailedChecks;
	}

	/**
	 * Returns a shallow copy of these options; the reporter is shared.
	 */
	@Override
	public Options clone() {
		try {
			return (Options) super.clone();
		} catch (CloneNotSupportedException e) {
			throw new InternalError(e);
		}
	}

	public String toString() {
		StringBuilder b = new StringBuilder();
		b.append("Options:");
		b.append("\n reporter: ");
		b.append(reporter);
		b.append("\n skipChecks: ");
		b.append(skipChecks);
		b.append("\n errorOnFailedChecks: ");
		b.append(errorOnFailedChecks);
		return b.toString();
	}
}
