package com.protogen.generator.resolver;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.protogen.generator.model.ExtendDescriptor;
import com.protogen.generator.model.FieldDescriptor;
import com.protogen.generator.model.MessageDescriptor;
import com.protogen.generator.model.ProtoDescriptor;
import com.protogen.generator.parser.ProtoResolver;

/**
 * Tests for merging extend blocks into their target messages.
 */
class ExtensionMergerTest {

    @TempDir
    Path tempDir;

    private ProtoResolver protoResolver;
    private SymbolTable symbolTable;

    @BeforeEach
    void setUp() {
        protoResolver = new ProtoResolver(List.of(tempDir));
        symbolTable = new SymbolTable();
    }

    @Test
    void testExtendBlocksAppendInDeclarationOrder() throws IOException {
        ProtoDescriptor proto = load("ext.proto", """
                package shop;
                message Item {
                  optional string sku = 1;
                  extensions 100 to 199;
                }
                extend Item { optional int32 weight = 100; }
                extend Item { optional string origin = 101; }
                """);

        List<ExtendDescriptor> skipped = new ExtensionMerger().merge(protoResolver.getLoadedProtos());

        MessageDescriptor item = proto.findMessage("Item").orElseThrow();
        assertThat(skipped).isEmpty();
        assertThat(item.getFields()).extracting(FieldDescriptor::getName).containsExactly("sku", "weight", "origin");
        assertThat(item.findField("origin").orElseThrow().isExtension()).isTrue();
        assertThat(proto.getExtends()).isEmpty();
    }

    @Test
    void testExtendAcrossPackages() throws IOException {
        write("base.proto", "package base; message Options { extensions 1000 to max; }");
        ProtoDescriptor ext = load("ext.proto", """
                package plugin;
                import "base.proto";
                message Label { optional string text = 1; }
                extend base.Options { optional Label label = 1000; }
                """);

        new ExtensionMerger().merge(protoResolver.getLoadedProtos());

        MessageDescriptor options = protoResolver.find("base.proto").orElseThrow().findMessage("Options").orElseThrow();
        FieldDescriptor label = options.findField("label").orElseThrow();
        assertThat(label.getTypeDescriptor()).isSameAs(ext.findMessage("Label").orElseThrow());
    }

    @Test
    void testExtendOfNestedMessage() throws IOException {
        ProtoDescriptor proto = load("nested.proto", """
                package n;
                message Outer { message Inner {} }
                extend Outer.Inner { optional bool flag = 5; }
                """);

        new ExtensionMerger().merge(protoResolver.getLoadedProtos());

        MessageDescriptor inner = proto.findMessage("Outer").orElseThrow().findMessage("Inner").orElseThrow();
        assertThat(inner.getFields()).extracting(FieldDescriptor::getName).containsExactly("flag");
    }

    @Test
    void testExtendDeclaredInsideMessageUsesMessageScope() throws IOException {
        write("host.proto", "package host; message Bar { extensions 100 to 199; }");
        ProtoDescriptor proto = load("nested-extend.proto", """
                package guest;
                import "host.proto";
                message Foo {
                  enum E { X = 0; }
                  message Local {}
                  extend host.Bar {
                    optional E e = 100;
                    optional Local local = 101;
                  }
                }
                """);
        MessageDescriptor foo = proto.findMessage("Foo").orElseThrow();
        ExtendDescriptor extend = proto.getExtends().get(0);

        new ExtensionMerger().merge(protoResolver.getLoadedProtos());

        assertThat(extend.getEnclosingMessage()).isSameAs(foo);
        assertThat(extend.getScope()).isEqualTo("guest.Foo");
        MessageDescriptor bar = protoResolver.find("host.proto").orElseThrow().findMessage("Bar").orElseThrow();
        assertThat(bar.findField("e").orElseThrow().getTypeDescriptor()).isSameAs(foo.findEnum("E").orElseThrow());
        assertThat(bar.findField("local").orElseThrow().getTypeDescriptor()).isSameAs(foo.findMessage("Local").orElseThrow());
    }

    @Test
    void testExtendBeforePackageStatementUsesFilePackage() throws IOException {
        ProtoDescriptor proto = load("late-package.proto", """
                extend Target { optional Kind kind = 10; }
                package late;
                message Target { extensions 10 to 20; }
                enum Kind { A = 0; }
                """);

        List<ExtendDescriptor> skipped = new ExtensionMerger().merge(protoResolver.getLoadedProtos());

        assertThat(skipped).isEmpty();
        MessageDescriptor target = proto.findMessage("Target").orElseThrow();
        assertThat(target.findField("kind").orElseThrow().getTypeDescriptor().getFullName()).isEqualTo("late.Kind");
    }

    @Test
    void testMissingTargetIsSkippedSilently() throws IOException {
        ProtoDescriptor proto = load("orphan.proto", """
                package orphan;
                message Present {}
                extend elsewhere.Absent { optional int32 value = 1; }
                """);

        List<ExtendDescriptor> skipped = new ExtensionMerger().merge(protoResolver.getLoadedProtos());

        assertThat(skipped).extracting(ExtendDescriptor::getTargetName).containsExactly("elsewhere.Absent");
        assertThat(proto.getExtends()).hasSize(1);
        assertThat(proto.findMessage("Present").orElseThrow().getFields()).isEmpty();
    }

    @Test
    void testMergingTwiceIsNoOp() throws IOException {
        ProtoDescriptor proto = load("twice.proto", """
                package t;
                message Target {}
                extend Target { optional int32 extra = 10; }
                """);
        ExtensionMerger merger = new ExtensionMerger();

        merger.merge(protoResolver.getLoadedProtos());
        merger.merge(protoResolver.getLoadedProtos());

        assertThat(proto.findMessage("Target").orElseThrow().getFields()).hasSize(1);
    }

    @Test
    void testMergeIntoFrozenMessage() throws IOException {
        ProtoDescriptor proto = load("frozen.proto", """
                package f;
                message Target { optional int32 a = 1; }
                extend Target { optional int32 b = 2; }
                """);
        proto.freeze();

        new ExtensionMerger().merge(protoResolver.getLoadedProtos());

        assertThat(proto.findMessage("Target").orElseThrow().getFields()).hasSize(2);
    }

    private void write(String fileName, String source) throws IOException {
        Files.writeString(tempDir.resolve(fileName), source);
    }

    private ProtoDescriptor load(String fileName, String source) throws IOException {
        write(fileName, source);
        ProtoDescriptor proto = protoResolver.load(fileName);
        List<ProtoDescriptor> batch = protoResolver.drainPending();
        new TypeIndexer(symbolTable).index(batch);
        new TypeResolver(symbolTable).resolve(batch);
        return proto;
    }
}
