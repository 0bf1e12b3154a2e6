package mu.fleet;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @Test
    void noCommandIsUsageError() {
        assertEquals(2, App.run(new String[0]));
    }

    @Test
    void unknownCommandIsUsageError() {
        assertEquals(2, App.run(new String[]{"queen"}));
    }

    @Test
    void hiveWithoutFlagsIsUsageError() {
        assertEquals(2, App.run(new String[]{"hive"}));
    }
}
