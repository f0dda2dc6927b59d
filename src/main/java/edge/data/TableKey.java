package edge.data;

import com.google.common.base.Joiner;

final class TableKey {

    private static final Joiner JOINER = Joiner.on('|').useForNull("*");

    private TableKey() {
    }

    static String of(Object... parts) {
        return JOINER.join(parts);
    }
}
