/*
 * Copyright 2025 The Styler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.styler.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Splitter;

/** A tree construction helper class. */
public class IR {

  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node block(Node... statements) {
    return new Node(Token.BLOCK, statements);
  }

  public static Node block(Iterable<Node> statements) {
    Node block = new Node(Token.BLOCK);
    block.addChildrenToBack(statements);
    return block;
  }

  public static Node module(Node name, Node body) {
    checkState(name.isQualifiedName(), name);
    checkState(body.isBlock(), body);
    return new Node(Token.MODULE, name, body);
  }

  public static Node protocol(Node name, Node body) {
    checkState(name.isQualifiedName(), name);
    checkState(body.isBlock(), body);
    return new Node(Token.PROTOCOL, name, body);
  }

  public static Node impl(Node name, Node forTarget, Node body) {
    checkState(name.isQualifiedName(), name);
    checkState(body.isBlock(), body);
    return new Node(Token.IMPL, name, forTarget, body);
  }

  public static Node alias(Node target, Node... options) {
    return directive(Token.ALIAS, target, options);
  }

  public static Node importNode(Node target, Node... options) {
    return directive(Token.IMPORT, target, options);
  }

  public static Node require(Node target, Node... options) {
    return directive(Token.REQUIRE, target, options);
  }

  public static Node use(Node target, Node... options) {
    return directive(Token.USE, target, options);
  }

  public static Node directive(Token token, Node target, Node... options) {
    checkArgument(token.isDirective(), token);
    Node directive = new Node(token, target);
    for (Node option : options) {
      directive.addChildToBack(option);
    }
    return directive;
  }

  /** Builds a qualified name from a dotted string of literal segments. */
  public static Node qname(String dotted) {
    Node qname = new Node(Token.QUALIFIED_NAME);
    for (String segment : DOT_SPLITTER.split(dotted)) {
      checkArgument(!segment.isEmpty(), "Empty segment in %s", dotted);
      qname.addChildToBack(name(segment));
    }
    return qname;
  }

  /** Builds a qualified name from literal or computed segments. */
  public static Node qname(Node... segments) {
    checkArgument(segments.length > 0);
    return new Node(Token.QUALIFIED_NAME, segments);
  }

  public static Node moduleRef() {
    return new Node(Token.MODULE_REF);
  }

  public static Node group(Node prefix, Node... targets) {
    checkState(prefix.isQualifiedName(), prefix);
    Node group = new Node(Token.GROUP, prefix);
    for (Node target : targets) {
      group.addChildToBack(target);
    }
    return group;
  }

  public static Node attribute(String name, Node... values) {
    Node attribute = Node.newString(Token.ATTRIBUTE, name);
    for (Node value : values) {
      attribute.addChildToBack(value);
    }
    return attribute;
  }

  public static Node struct(String definer, Node... args) {
    Node struct = Node.newString(Token.STRUCT, definer);
    for (Node arg : args) {
      struct.addChildToBack(arg);
    }
    return struct;
  }

  public static Node function(String name, Node params, Node body) {
    checkState(params.getToken() == Token.LIST, params);
    checkState(body.isBlock(), body);
    Node function = Node.newString(Token.FUNCTION, name);
    function.addChildToBack(params);
    function.addChildToBack(body);
    return function;
  }

  /** A call of {@code fun}; pass {@link #empty()} as the receiver for a local call. */
  public static Node call(Node receiver, String fun, Node... args) {
    Node call = Node.newString(Token.CALL, fun);
    call.addChildToBack(receiver);
    for (Node arg : args) {
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node quote(Node body) {
    checkState(body.isBlock(), body);
    return new Node(Token.QUOTE, body);
  }

  public static Node keyword(String key, Node value) {
    Node keyword = Node.newString(Token.KEYWORD, key);
    keyword.addChildToBack(value);
    return keyword;
  }

  public static Node list(Node... elements) {
    return new Node(Token.LIST, elements);
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node string(String value) {
    return Node.newString(Token.STRINGLIT, value);
  }

  public static Node number(String literal) {
    return Node.newString(Token.NUMBER, literal);
  }
}
