package com.sgfplayer.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Connectivity queries on a {@link BoardSnapshot}: stone groups, their liberties, and the
 * territory estimate used when a finished game is scored.
 */
public final class GroupAnalyzer {

    private GroupAnalyzer() {
    }

    /**
     * Returns the maximal group of same-coloured stones orthogonally connected to {@code start}.
     * The result is empty if {@code start} is an empty intersection.
     */
    public static List<Point> collectGroup(BoardSnapshot board, Point start) {
        Stone color = board.stoneAt(start);
        if (color == null) {
            return List.of();
        }
        int size = board.size();
        List<Point> group = new ArrayList<>();
        Set<Point> visited = new HashSet<>();
        Deque<Point> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            Point point = stack.pop();
            if (!visited.add(point)) {
                continue;
            }
            group.add(point);
            for (Point neighbor : point.neighbors(size)) {
                if (!visited.contains(neighbor) && board.stoneAt(neighbor) == color) {
                    stack.push(neighbor);
                }
            }
        }
        return group;
    }

    /**
     * Returns the empty intersections orthogonally adjacent to any stone of {@code group}.
     */
    public static Set<Point> liberties(BoardSnapshot board, Collection<Point> group) {
        Set<Point> liberties = new LinkedHashSet<>();
        int size = board.size();
        for (Point point : group) {
            for (Point neighbor : point.neighbors(size)) {
                if (board.isEmpty(neighbor)) {
                    liberties.add(neighbor);
                }
            }
        }
        return liberties;
    }

    /**
     * Returns {@code true} if placing {@code color} on the empty intersection {@code point} would
     * leave its group without liberties while capturing nothing. Occupied or off-board points are
     * never suicide.
     */
    public static boolean isSuicide(BoardSnapshot board, Stone color, Point point) {
        if (!board.isOnBoard(point) || !board.isEmpty(point)) {
            return false;
        }
        BoardSnapshot placed = board.withStone(point, color);
        Stone opponent = color.opponent();
        for (Point neighbor : point.neighbors(placed.size())) {
            if (placed.stoneAt(neighbor) == opponent
                    && liberties(placed, collectGroup(placed, neighbor)).isEmpty()) {
                return false;
            }
        }
        return liberties(placed, collectGroup(placed, point)).isEmpty();
    }

    /**
     * Assigns every empty region bordered by stones of exactly one colour to that colour. Stones
     * listed in {@code deadStones} are treated as removed before the regions are flooded.
     */
    public static Map<Point, Stone> estimateTerritory(BoardSnapshot board, Collection<Point> deadStones) {
        BoardSnapshot cleared = board.withoutStones(deadStones.stream().filter(board::isOnBoard).toList());
        int size = cleared.size();
        Map<Point, Stone> territory = new LinkedHashMap<>();
        Set<Point> visited = new HashSet<>();

        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                Point origin = new Point(x, y);
                if (!cleared.isEmpty(origin) || visited.contains(origin)) {
                    continue;
                }
                List<Point> region = new ArrayList<>();
                Set<Stone> borders = EnumSet.noneOf(Stone.class);
                Deque<Point> queue = new ArrayDeque<>();
                queue.add(origin);
                visited.add(origin);
                while (!queue.isEmpty()) {
                    Point current = queue.poll();
                    region.add(current);
                    for (Point neighbor : current.neighbors(size)) {
                        Stone stone = cleared.stoneAt(neighbor);
                        if (stone != null) {
                            borders.add(stone);
                        } else if (visited.add(neighbor)) {
                            queue.add(neighbor);
                        }
                    }
                }
                if (borders.size() == 1) {
                    Stone owner = borders.iterator().next();
                    for (Point point : region) {
                        territory.put(point, owner);
                    }
                }
            }
        }
        return territory;
    }
}
