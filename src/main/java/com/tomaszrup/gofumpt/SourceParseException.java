////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.gofumpt;

/**
 * The source could not be parsed. Raised by a {@link SourceParser} and
 * passed on unchanged; no rule runs on input that does not parse.
 */
public class SourceParseException extends Exception {
	private static final long serialVersionUID = 1L;

	private final int offset;

	public SourceParseException(String message, int offset) {
		super(message);
		this.offset = offset;
	}

	public SourceParseException(String message, int offset, Throwable cause) {
		super(message, cause);
		this.offset = offset;
	}

	/**
	 * Byte offset of the error, or -1 when unknown.
	 */
	public int getOffset() {
		return offset;
	}
}
