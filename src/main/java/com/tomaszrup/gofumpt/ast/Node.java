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
package com.tomaszrup.gofumpt.ast;

/**
 * Base class of all syntax tree nodes.
 */
public abstract class Node {

	public abstract NodeKind kind();

	/**
	 * Position of the first byte belonging to the node.
	 */
	public abstract int pos();

	/**
	 * Position immediately after the node.
	 */
	public abstract int end();

	@Override
	public String toString() {
		return kind() + "[" + pos() + "," + end() + ")";
	}
}
