
package info.freelibrary.mwtree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Comparator;
import java.util.Properties;

import org.junit.After;
import org.junit.Test;

public class TreeFactoryTest {

    private final TreeFactory myFactory = TreeFactory.getInstance();

    @After
    public void after() {
        myFactory.setProperty(Constants.NODE_CAPACITY, Constants.DEFAULT_CAPACITY);
    }

    @Test
    public void testDefaultCapacity() {
        final SortedTree<Integer> tree = myFactory.createTree();

        assertEquals(Constants.DEFAULT_CAPACITY, tree.getCapacity());
        assertTrue(tree.isEmpty());
    }

    @Test
    public void testCapacityProperty() {
        myFactory.setProperty(Constants.NODE_CAPACITY, "7");

        assertEquals(7, myFactory.getNodeCapacity());
        assertEquals(7, myFactory.<String>createTree().getCapacity());
        assertEquals("7", myFactory.getProperty(Constants.NODE_CAPACITY));
    }

    @Test
    public void testNumericCapacityProperty() {
        myFactory.setProperty(Constants.NODE_CAPACITY, 12L);
        assertEquals(12, myFactory.createTree(Comparator.<Integer>naturalOrder()).getCapacity());
    }

    @Test
    public void testSetProperties() {
        final Properties properties = new Properties();

        properties.setProperty(Constants.NODE_CAPACITY, " 3 ");
        properties.setProperty("mwtree.unrelated", "value");
        myFactory.setProperties(properties);

        assertEquals(3, myFactory.getNodeCapacity());
        assertEquals("value", myFactory.getProperty("mwtree.unrelated"));
        assertNull(myFactory.getProperty("mwtree.missing"));
    }

    @Test
    public void testBadCapacityProperty() {
        for (final Object value : new Object[] { "many", "0", -4, Boolean.TRUE, "" }) {
            try {
                myFactory.setProperty(Constants.NODE_CAPACITY, value);
                fail("Expected an IllegalArgumentException for " + value);
            } catch (final IllegalArgumentException details) {
                assertEquals(Constants.DEFAULT_CAPACITY, myFactory.getNodeCapacity());
            }
        }
    }

    @Test
    public void testCreateTree() {
        final SortedTree<String> tree = myFactory.createTree(1, Comparator.reverseOrder());

        tree.insert("b");
        tree.insert("c");
        tree.insert("a");

        assertEquals("c b a", tree.toString());
        assertEquals(2, tree.getHeight());
        assertEquals(3, tree.getNodeCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroCapacity() {
        myFactory.createTree(0);
    }

}
