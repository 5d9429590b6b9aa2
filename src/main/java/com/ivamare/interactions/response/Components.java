package com.ivamare.interactions.response;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Component tree of a message or modal: up to five action rows.
 *
 * <p>Components added without a row index go into the first row with room left.
 */
public class Components {

    public static final int MAX_ROWS = 5;

    private final List<ActionRow> rows = new ArrayList<>();

    public Components() {
        for (int i = 0; i < MAX_ROWS; i++) {
            rows.add(new ActionRow());
        }
    }

    public static Components of(MessageComponent... components) {
        Components tree = new Components();
        for (MessageComponent component : components) {
            tree.add(component);
        }
        return tree;
    }

    public Components add(MessageComponent component) {
        for (ActionRow row : rows) {
            if (row.fits(component)) {
                row.add(component);
                return this;
            }
        }
        throw new IllegalArgumentException("Cannot add component, all rows are full");
    }

    public Components add(MessageComponent component, int row) {
        if (row < 0 || row >= MAX_ROWS) {
            throw new IllegalArgumentException("Row " + row + " does not exist");
        }
        rows.get(row).add(component);
        return this;
    }

    /**
     * Append every component of another tree, keeping their row assignment where it fits.
     *
     * @param other tree to merge in
     * @return this tree
     */
    public Components addAll(Components other) {
        for (int i = 0; i < MAX_ROWS; i++) {
            for (MessageComponent component : other.rows.get(i).components()) {
                if (rows.get(i).fits(component)) {
                    rows.get(i).add(component);
                } else {
                    add(component);
                }
            }
        }
        return this;
    }

    public boolean remove(String customId) {
        for (ActionRow row : rows) {
            if (row.remove(customId)) {
                return true;
            }
        }
        return false;
    }

    public List<MessageComponent> all() {
        List<MessageComponent> all = new ArrayList<>();
        rows.forEach(row -> all.addAll(row.components()));
        return all;
    }

    public boolean isEmpty() {
        return rows.stream().allMatch(ActionRow::isEmpty);
    }

    public List<Map<String, Object>> toList() {
        return rows.stream()
            .filter(row -> !row.isEmpty())
            .map(ActionRow::toMap)
            .toList();
    }
}
