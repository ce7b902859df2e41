package edu.cmu.cs.cs15745.isle;

import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

public class TestNodeEmbedding {

  @Test
  public void addIsMonotone() {
    var embedding = NodeEmbedding.of(Map.of(10, 0));
    Assert.assertTrue(embedding.add(11, 1));
    Assert.assertFalse(embedding.add(11, 1));
    Assert.assertThrows(IllegalStateException.class, () -> embedding.add(11, 2));
    Assert.assertEquals(Map.of(10, 0, 11, 1), embedding.image());
  }

  @Test
  public void sharedLeftNode() throws NotIncludedException {
    var embedding = new NodeEmbedding();
    embedding.add(10, 0);
    embedding.add(11, 0);
    Assert.assertTrue(embedding.hasPreimage(0));
    Assert.assertEquals(Map.of(10, 0, 11, 0), embedding.image());
    Assert.assertFalse(embedding.hasPreimage(1));
    Assert.assertEquals(0, embedding.find(11));
  }

  @Test(expected = NotIncludedException.class)
  public void findUnmapped() throws NotIncludedException {
    new NodeEmbedding().find(3);
  }

  @Test
  public void copiesAreIndependent() {
    var embedding = NodeEmbedding.of(Map.of(10, 0));
    var copy = embedding.copy();
    copy.add(11, 1);
    Assert.assertFalse(embedding.contains(11));
    Assert.assertEquals(2, copy.size());
  }
}
