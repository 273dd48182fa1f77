/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
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
package io.herald.sort;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Declared order of the tests in a suite: a tree of tests, described scopes and
 * free-standing info messages.
 * <pre>
 * SuiteStructure.of(
 *     scope("A stack",
 *         test("A stack should pop"),
 *         test("A stack should push")),
 *     info("done"));
 * </pre>
 */
public final class SuiteStructure {

    public sealed interface Node permits TestLeaf, ScopeBranch, InfoLeaf {
    }

    public record TestLeaf(String testName) implements Node {
    }

    public record InfoLeaf(String message) implements Node {
    }

    public record ScopeBranch(String message, List<Node> children) implements Node {

        public ScopeBranch {
            children = List.copyOf(children);
        }

    }

    private final List<Node> nodes;

    private SuiteStructure(List<Node> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    public static SuiteStructure of(Node... nodes) {
        return new SuiteStructure(Arrays.asList(nodes));
    }

    public static SuiteStructure of(List<Node> nodes) {
        return new SuiteStructure(nodes);
    }

    public static SuiteStructure ofTests(String... testNames) {
        return ofTests(Arrays.asList(testNames));
    }

    public static SuiteStructure ofTests(List<String> testNames) {
        List<Node> list = new ArrayList<>(testNames.size());
        for (String name : testNames) {
            list.add(new TestLeaf(name));
        }
        return new SuiteStructure(list);
    }

    public static TestLeaf test(String testName) {
        return new TestLeaf(testName);
    }

    public static InfoLeaf info(String message) {
        return new InfoLeaf(message);
    }

    public static ScopeBranch scope(String message, Node... children) {
        return new ScopeBranch(message, Arrays.asList(children));
    }

    public List<Node> getNodes() {
        return nodes;
    }

    /**
     * Test names in declared (depth-first) order.
     */
    public List<String> getTestNames() {
        List<String> names = new ArrayList<>();
        collectTestNames(nodes, names);
        return Collections.unmodifiableList(names);
    }

    public int getTestCount() {
        return getTestNames().size();
    }

    private static void collectTestNames(List<Node> list, List<String> names) {
        for (Node node : list) {
            if (node instanceof TestLeaf leaf) {
                names.add(leaf.testName());
            } else if (node instanceof ScopeBranch branch) {
                collectTestNames(branch.children(), names);
            }
        }
    }

    /**
     * Flattens the tree into slots: a scope becomes an opening slot, its children,
     * then a closing slot.
     */
    List<TestSlot> linearize() {
        List<TestSlot> slots = new ArrayList<>();
        linearize(nodes, slots);
        return slots;
    }

    private static void linearize(List<Node> list, List<TestSlot> slots) {
        for (Node node : list) {
            if (node instanceof TestLeaf leaf) {
                slots.add(TestSlot.test(leaf.testName()));
            } else if (node instanceof InfoLeaf leaf) {
                slots.add(TestSlot.expect(TestSlot.Kind.INFO, leaf.message()));
            } else if (node instanceof ScopeBranch branch) {
                slots.add(TestSlot.expect(TestSlot.Kind.SCOPE_OPENED, branch.message()));
                linearize(branch.children(), slots);
                slots.add(TestSlot.expect(TestSlot.Kind.SCOPE_CLOSED, branch.message()));
            }
        }
    }

}
