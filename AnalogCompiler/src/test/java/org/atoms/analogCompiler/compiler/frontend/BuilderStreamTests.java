package org.atoms.analogCompiler.compiler.frontend;

import org.atoms.analogCompiler.compiler.frontend.builder.Builder;
import org.atoms.analogCompiler.compiler.frontend.builder.BuilderNodeKind;
import org.atoms.analogCompiler.compiler.frontend.builder.RegisterBuilder;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/** Unit tests for the linearized view of builder chains */
public class BuilderStreamTests {
    static Builder chain() {
        return RegisterBuilder.chain(2, 5)
                .rydberg()
                .detuning()
                .uniform()
                .constant(1, 1);
    }

    @Test
    public void testCallOrder() {
        BuilderStream stream = BuilderStream.create(chain());
        Assert.assertEquals(5, stream.size());
        List<BuilderNodeKind> kinds = new ArrayList<>();
        for (BuilderNode node = stream.read(); node != null; node = stream.read())
            kinds.add(node.kind());
        Assert.assertEquals(List.of(BuilderNodeKind.REGISTER, BuilderNodeKind.RYDBERG,
                BuilderNodeKind.DETUNING, BuilderNodeKind.UNIFORM, BuilderNodeKind.CONSTANT), kinds);
        Assert.assertNull(stream.current());
        Assert.assertNull(stream.read());
    }

    @Test
    public void testCopyIsIndependent() {
        BuilderStream stream = BuilderStream.create(chain());
        stream.read();
        BuilderStream copy = stream.copy();
        copy.read();
        copy.read();
        BuilderNode current = stream.current();
        Assert.assertNotNull(current);
        Assert.assertEquals(BuilderNodeKind.RYDBERG, current.kind());
        BuilderNode copyCurrent = copy.current();
        Assert.assertNotNull(copyCurrent);
        Assert.assertEquals(BuilderNodeKind.UNIFORM, copyCurrent.kind());
    }

    @Test
    public void testReadNext() {
        BuilderStream stream = BuilderStream.create(chain());
        BuilderNode node = stream.readNext(EnumSet.of(BuilderNodeKind.UNIFORM, BuilderNodeKind.SCALE));
        Assert.assertNotNull(node);
        Assert.assertEquals(BuilderNodeKind.UNIFORM, node.kind());
        BuilderNode next = node.next();
        Assert.assertNotNull(next);
        Assert.assertEquals(BuilderNodeKind.CONSTANT, next.kind());
        Assert.assertNull(next.next());

        BuilderNode current = stream.current();
        Assert.assertNotNull(current);
        Assert.assertEquals(BuilderNodeKind.CONSTANT, current.kind());
        Assert.assertNull(stream.readNext(EnumSet.of(BuilderNodeKind.PARALLELIZE)));
        Assert.assertNull(stream.current());
    }
}
