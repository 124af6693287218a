// Copyright 2026 The ModelScript Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.modelscript.java.model;

/** How the model rewriter treats a call, according to what the called value is. */
public enum Classification {
  /**
   * The callee constructs a stochastic node: an assignment of its result becomes a suspension
   * point.
   */
  SUSPENSION_ELIGIBLE,

  /**
   * The callee is another model: an assignment of its result delegates to that model's
   * computation, whose suspensions become suspensions of the caller.
   */
  DELEGATE,

  /** The callee is an ordinary function: the call is left as it is. */
  OPAQUE
}
