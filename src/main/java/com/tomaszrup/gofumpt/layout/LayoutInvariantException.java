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
package com.tomaszrup.gofumpt.layout;

/**
 * Raised when a rule would leave the line table or a length estimate in an
 * inconsistent state. Every later position lookup would be wrong, so the
 * whole formatting run is aborted.
 */
public class LayoutInvariantException extends IllegalStateException {
	private static final long serialVersionUID = 1L;

	public LayoutInvariantException(String message) {
		super(message);
	}

	public LayoutInvariantException(String message, Throwable cause) {
		super(message, cause);
	}
}
