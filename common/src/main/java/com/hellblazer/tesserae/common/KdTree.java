/**
 * Copyright (C) 2023 Hal Hildebrand. All rights reserved.
 * 
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License as published by the Free
 * Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 * 
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 * 
 * You should have received a copy of the GNU Affero General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.tesserae.common;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import javax.vecmath.Point3i;
import javax.vecmath.Tuple3i;

/**
 * A balanced 3-d tree over integer points, each carrying an integer identifier.
 * <p>
 * Nearest neighbor queries use squared Euclidean distance. Points at the same
 * distance from the target resolve to the one with the lowest identifier, so a
 * query is a pure function of the target regardless of how the tree was
 * partitioned. The tree is immutable once built and safe for concurrent queries.
 *
 * @author hal.hildebrand
 */
public class KdTree {
    public static final int DIMENSIONS = 3;

    /**
     * The result of a nearest neighbor query
     *
     * @param node            the nearest node
     * @param distanceSquared squared distance from the target to the node
     * @param visited         number of nodes examined by the query
     */
    public record Match(Node node, long distanceSquared, int visited) {
        public int id() {
            return node.id();
        }
    }

    public static class Node {
        private final Point3i coords_;
        private final int     id_;
        private Node          left_  = null;
        private Node          right_ = null;

        public Node(Tuple3i p, int id) {
            coords_ = new Point3i(p);
            id_ = id;
        }

        public Point3i coords() {
            return new Point3i(coords_);
        }

        public int id() {
            return id_;
        }

        @Override
        public String toString() {
            return id_ + "@" + coords_;
        }

        long distanceSquared(Tuple3i p) {
            long dx = coords_.x - p.x;
            long dy = coords_.y - p.y;
            long dz = coords_.z - p.z;
            return dx * dx + dy * dy + dz * dz;
        }

        int get(int index) {
            return switch (index) {
            case 0:
                yield coords_.x;
            case 1:
                yield coords_.y;
            case 2:
                yield coords_.z;
            default:
                throw new IllegalArgumentException("Unexpected index: " + index);
            };
        }
    }

    //
    // Java implementation of quickselect algorithm.
    // See https://en.wikipedia.org/wiki/Quickselect
    //
    static class QuickSelect {
        private static final Random random = new Random();

        static <T> T select(List<T> list, int left, int right, int n, Comparator<? super T> cmp) {
            for (;;) {
                if (left == right)
                    return list.get(left);
                int pivot = pivotIndex(left, right);
                pivot = partition(list, left, right, pivot, cmp);
                if (n == pivot)
                    return list.get(n);
                else if (n < pivot)
                    right = pivot - 1;
                else
                    left = pivot + 1;
            }
        }

        private static <T> int partition(List<T> list, int left, int right, int pivot, Comparator<? super T> cmp) {
            T pivotValue = list.get(pivot);
            swap(list, pivot, right);
            int store = left;
            for (int i = left; i < right; ++i) {
                if (cmp.compare(list.get(i), pivotValue) < 0) {
                    swap(list, store, i);
                    ++store;
                }
            }
            swap(list, right, store);
            return store;
        }

        private static int pivotIndex(int left, int right) {
            return left + random.nextInt(right - left + 1);
        }

        private static <T> void swap(List<T> list, int i, int j) {
            T value = list.get(i);
            list.set(i, list.get(j));
            list.set(j, value);
        }
    }

    // Total order: the axis coordinate, then the identifier
    private static class NodeComparator implements Comparator<Node> {
        private final int index_;

        private NodeComparator(int index) {
            index_ = index;
        }

        @Override
        public int compare(Node n1, Node n2) {
            int c = Integer.compare(n1.get(index_), n2.get(index_));
            return c != 0 ? c : Integer.compare(n1.id_, n2.id_);
        }
    }

    // Per-query state, so concurrent queries never share a cursor
    private static class Search {
        private final Tuple3i target;
        private Node          best         = null;
        private long          bestDistance = 0;
        private int           visited      = 0;

        private Search(Tuple3i target) {
            this.target = target;
        }
    }

    private final Node root_;
    private final int  size_;

    public KdTree(List<Node> nodes) {
        var working = new ArrayList<>(nodes);
        size_ = working.size();
        root_ = makeTree(working, 0, working.size(), 0);
    }

    public Match findNearest(Tuple3i target) {
        if (root_ == null)
            throw new IllegalStateException("Tree is empty!");
        var search = new Search(target);
        nearest(root_, search, 0);
        return new Match(search.best, search.bestDistance, search.visited);
    }

    public boolean isEmpty() {
        return root_ == null;
    }

    public int size() {
        return size_;
    }

    private Node makeTree(List<Node> nodes, int begin, int end, int index) {
        if (end <= begin)
            return null;
        int n = begin + (end - begin) / 2;
        Node node = QuickSelect.select(nodes, begin, end - 1, n, new NodeComparator(index));
        index = (index + 1) % DIMENSIONS;
        node.left_ = makeTree(nodes, begin, n, index);
        node.right_ = makeTree(nodes, n + 1, end, index);
        return node;
    }

    private void nearest(Node root, Search search, int index) {
        if (root == null)
            return;
        ++search.visited;
        long d = root.distanceSquared(search.target);
        if (search.best == null || d < search.bestDistance
        || (d == search.bestDistance && root.id_ < search.best.id_)) {
            search.bestDistance = d;
            search.best = root;
        }
        long dx = (long) root.get(index) - getAxis(search.target, index);
        index = (index + 1) % DIMENSIONS;
        nearest(dx > 0 ? root.left_ : root.right_, search, index);
        // Equal distance on the far side may still hold a lower identifier
        if (dx * dx > search.bestDistance)
            return;
        nearest(dx > 0 ? root.right_ : root.left_, search, index);
    }

    private static int getAxis(Tuple3i p, int index) {
        return switch (index) {
        case 0:
            yield p.x;
        case 1:
            yield p.y;
        case 2:
            yield p.z;
        default:
            throw new IllegalArgumentException("Unexpected index: " + index);
        };
    }
}
