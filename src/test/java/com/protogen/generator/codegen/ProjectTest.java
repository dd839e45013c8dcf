package com.protogen.generator.codegen;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.protogen.generator.TestResources;
import com.protogen.generator.codegen.model.GeneratedFile;
import com.protogen.generator.exception.UnresolvedImportException;
import com.protogen.generator.exception.UnresolvedTypeException;
import com.protogen.generator.model.FieldDescriptor;
import com.protogen.generator.model.MessageDescriptor;
import com.protogen.generator.model.ProtoDescriptor;

/**
 * Tests for Project: loading, lookups, extension merging and compile output routing.
 */
class ProjectTest {

    @TempDir
    Path tempDir;

    private Path baseDir;
    private List<GeneratedFile> written;

    @BeforeEach
    void setUp() {
        baseDir = TestResources.baseDir();
        written = new ArrayList<>();
    }

    @Test
    void testGetProtosIncludesImports() {
        Project project = new Project(baseDir);
        project.addProto("protos/vehicle.proto");
        project.addProto("protos/person.proto");

        assertThat(project.getProtos()).extracting(ProtoDescriptor::getName)
                .containsExactly("vehicle.proto", "person.proto", "common.proto");

        ProtoDescriptor person = project.getProtos("protos/person.proto");
        assertThat(person.getName()).isEqualTo("person.proto");
        assertThat((List<?>) person.toTemplateObject().get("imports")).hasSize(1);
    }

    @Test
    void testGetProtosOfUnknownFileFails() {
        Project project = new Project(baseDir);
        project.addProto("protos/vehicle.proto");

        assertThatThrownBy(() -> project.getProtos("protos/person.proto"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown proto file");
        assertThatThrownBy(() -> project.getProtos("protos/does-not-exist.proto"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testKitchenSinkLoadOrder() {
        Project project = new Project(baseDir);
        project.addProto("protos/kitchen-sink.proto");

        assertThat(project.getProtos()).extracting(ProtoDescriptor::getName).containsExactly(
                "kitchen-sink.proto", "options.proto", "descriptor.proto", "otherOptions.proto", "common.proto");
    }

    @Test
    void testFindType() {
        Project project = new Project(baseDir);
        project.addProto("protos/person.proto");

        assertThat(project.findType("examples.Person.PhoneType")).isPresent();
        assertThat(project.findType(".common.Color")).isPresent();
        assertThat(project.findType("Person")).isEmpty();
    }

    @Test
    void testTypeResolutionAcrossFiles() {
        Project project = new Project(baseDir);
        MessageDescriptor person = project.addProto("protos/person.proto").findMessage("Person").orElseThrow();

        FieldDescriptor customFields = person.findField("customFields").orElseThrow();

        assertThat(customFields.getTypeDescriptor().getName()).isEqualTo("StringPair");
        assertThat(customFields.getTypeDescriptor()).isSameAs(project.findType("common.StringPair").orElseThrow());
    }

    @Test
    void testTypeResolutionInner() {
        Project project = new Project(baseDir);
        MessageDescriptor tortilla = project.addProto("protos/inner.proto").findMessage("Tortilla").orElseThrow();

        List<?> fields = (List<?>) tortilla.toTemplateObject().get("fields");

        assertThat(fields).extracting(ProjectTest::fullNameOf).containsExactly(
                "burrito.Tortilla.Filling", "burrito.Tortilla.Filling",
                "burrito.Tortilla.Guac", "burrito.Tortilla.Guac");
    }

    @Test
    void testServiceTypeResolution() {
        Project project = new Project(baseDir);
        Map<String, Object> shoes = project.addProto("protos/services.proto").toTemplateObject();

        Map<?, ?> running = (Map<?, ?>) ((List<?>) shoes.get("services")).get(0);
        Map<?, ?> lace = (Map<?, ?>) ((List<?>) running.get("methods")).get(0);
        Map<?, ?> input = (Map<?, ?>) lace.get("inputTypeDescriptor");
        Map<?, ?> output = (Map<?, ?>) lace.get("outputTypeDescriptor");

        assertThat(running.get("fullName")).isEqualTo("shoes.RunningShoe");
        assertThat(lace.get("name")).isEqualTo("LaceShoe");
        assertThat(lace.get("camelName")).isEqualTo("laceShoe");
        assertThat(lace.get("upperUnderscoreName")).isEqualTo("LACE_SHOE");
        assertThat(input.get("fullName")).isEqualTo("shoes.Shoe");
        assertThat(output.get("fullName")).isEqualTo("shoes.FullShoe");
        assertThat(camelNames(input)).containsExactly("shoeId");
        assertThat(camelNames(output)).containsExactly("shoeId", "isLaced", "strideCount");
    }

    @Test
    void testTypeResolutionLoop() {
        Project project = new Project(baseDir);
        MessageDescriptor dee = project.addProto("protos/loop.proto").findMessage("TweedleDee").orElseThrow();

        Map<String, Object> dum = dee.findField("dum").orElseThrow().toTemplateObject();
        Map<?, ?> dumType = (Map<?, ?>) dum.get("typeDescriptor");

        assertThat(dumType.get("name")).isEqualTo("TweedleDum");
        assertThat((List<?>) dumType.get("fields")).hasSize(1);
    }

    @Test
    void testUnresolvedTypeFailsLoad() throws IOException {
        Files.writeString(tempDir.resolve("broken.proto"), "package b; message M { optional Ghost g = 1; }");
        Project project = new Project(tempDir);

        assertThatThrownBy(() -> project.addProto("broken.proto"))
                .isInstanceOf(UnresolvedTypeException.class)
                .hasMessageContaining("g")
                .hasMessageContaining("b.M")
                .hasMessageContaining("Ghost");
    }

    @Test
    void testAddProtoCanBeRetriedAfterMissingImport() throws IOException {
        Files.writeString(tempDir.resolve("root.proto"), """
                package r;
                import "ok.proto";
                import "missing.proto";
                message Root { optional ok.Ok ok = 1; optional m.Missing missing = 2; }
                """);
        Files.writeString(tempDir.resolve("ok.proto"), "package ok; message Ok {}");
        Project project = new Project(tempDir);

        assertThatThrownBy(() -> project.addProto("root.proto")).isInstanceOf(UnresolvedImportException.class);
        assertThatThrownBy(() -> project.addProto("root.proto")).isInstanceOf(UnresolvedImportException.class);
        assertThat(project.getProtos()).isEmpty();

        Files.writeString(tempDir.resolve("missing.proto"), "package m; message Missing {}");
        ProtoDescriptor root = project.addProto("root.proto");

        assertThat(root.getImports()).extracting(ProtoDescriptor::getName).containsExactly("ok.proto", "missing.proto");
        MessageDescriptor message = root.findMessage("Root").orElseThrow();
        assertThat(message.findField("missing").orElseThrow().getTypeDescriptor().getFullName()).isEqualTo("m.Missing");
        assertThat(project.findType("ok.Ok")).isPresent();
    }

    @Test
    void testResolutionFailureEndsTheSession() throws IOException {
        Files.writeString(tempDir.resolve("broken.proto"), "package b; message M { optional Ghost g = 1; }");
        Files.writeString(tempDir.resolve("fine.proto"), "package f; message F {}");
        Project project = new Project(tempDir);

        assertThatThrownBy(() -> project.addProto("broken.proto")).isInstanceOf(UnresolvedTypeException.class);

        assertThatThrownBy(() -> project.addProto("broken.proto"))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(UnresolvedTypeException.class);
        assertThatThrownBy(() -> project.addProto("fine.proto")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(project::compile).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testRemoveAndAddSyntheticField() {
        Project project = new Project(baseDir);
        MessageDescriptor color = project.addProto("protos/common.proto").findMessage("Color").orElseThrow();
        assertThat((List<?>) color.toTemplateObject().get("fields")).hasSize(3);

        color.removeFieldByName("red");
        assertThat((List<?>) color.toTemplateObject().get("fields")).hasSize(2);

        color.addSyntheticField("int32", "alpha", 4);
        assertThat(color.getFields()).extracting(FieldDescriptor::getName).containsExactly("green", "blue", "alpha");
    }

    @Test
    void testBasicCompilation() throws IOException {
        List<GeneratedFile> generated = new Project(baseDir)
                .addJob("protos/vehicle.proto", "justNames.ftl", ".xx.js")
                .setTemplateDir("templates")
                .setOutDir("generated-stuff")
                .setOutputFunction(this::capture)
                .compile();

        assertThat(written).hasSize(1);
        assertThat(written.get(0).getContents()).isEqualTo("Proto=vehicle.proto,Msg=Vehicle,");
        assertThat(written.get(0).getOutputPath())
                .isEqualTo(baseDir.resolve("generated-stuff/protos/vehicle.proto.xx.js"));
        assertThat(generated).isEqualTo(written);
    }

    @Test
    void testSuffixSpecificOutputDir() throws IOException {
        new Project(baseDir)
                .addJob("protos/vehicle.proto", "justNames.ftl", ".java")
                .addJob("protos/vehicle.proto", "justNames.ftl", ".xx.js")
                .addJob("protos/vehicle.proto", "justNames.ftl", ".h")
                .setTemplateDir("templates")
                .setOutDir("generated-stuff")
                .setOutDir("java/generated-stuff", ".java")
                .setOutputFunction(this::capture)
                .compile();

        assertThat(written).extracting(GeneratedFile::getContents).containsOnly("Proto=vehicle.proto,Msg=Vehicle,");
        assertThat(written).extracting(GeneratedFile::getOutputPath).containsExactly(
                baseDir.resolve("java/generated-stuff/protos/VehicleProtos.java"),
                baseDir.resolve("generated-stuff/protos/vehicle.proto.xx.js"),
                baseDir.resolve("generated-stuff/protos/PBVehicle.h"));
    }

    @Test
    void testDefaultSuffixAndOutputFunctionWriteFile() throws IOException {
        new Project(baseDir)
                .addJob("protos/common.proto", "justNames.ftl")
                .setTemplateDir("templates")
                .setOutDir(tempDir)
                .compile();

        Path expected = tempDir.resolve("protos/common.proto.txt");
        assertThat(expected).exists();
        assertThat(Files.readString(expected)).isEqualTo("Proto=common.proto,Msg=Color,Msg=StringPair,");
    }

    @Test
    void testCustomRendererReceivesTemplateObject() throws IOException {
        List<String> templates = new ArrayList<>();
        new Project(baseDir)
                .addJob("protos/loop.proto", "anything", ".out")
                .setRenderer((templateName, model) -> {
                    templates.add(templateName);
                    return "package=" + model.get("package");
                })
                .setOutputFunction(this::capture)
                .compile();

        assertThat(templates).containsExactly("anything");
        assertThat(written).singleElement().extracting(GeneratedFile::getContents).isEqualTo("package=loop");
        assertThat(written.get(0).getOutputPath()).isEqualTo(baseDir.resolve("genfiles/protos/loop.proto.out"));
    }

    @Test
    void testCompileMergesExtensionsAndFreezes() throws IOException {
        Project project = new Project(baseDir)
                .addJob("protos/kitchen-sink.proto", "summary.ftl")
                .setTemplateDir("templates")
                .setOutputFunction(this::capture);

        project.compile();

        MessageDescriptor sink = project.getProtos("protos/kitchen-sink.proto").findMessage("Sink").orElseThrow();
        assertThat(sink.getFields()).extracting(FieldDescriptor::getName).endsWith("brand", "trim");
        assertThat(sink.isFrozen()).isTrue();
        assertThatThrownBy(() -> sink.removeFieldByName("id")).isInstanceOf(IllegalStateException.class);

        MessageDescriptor fieldOptions = (MessageDescriptor) project.findType("google.protobuf.FieldOptions").orElseThrow();
        assertThat(fieldOptions.findField("sensitive")).isPresent();
        assertThat(project.getDiagnostics().getInfos()).singleElement().asString().contains("missing.Thing");

        assertThat(written.get(0).getContents())
                .contains("kitchen.Sink: id material=kitchen.Sink.Material color=common.Color")
                .contains("kitchen.SinkService.INSTALL(kitchen.Sink) -> kitchen.Sink");
    }

    @Test
    void testCompileTwiceDoesNotDuplicateExtensions() throws IOException {
        Project project = new Project(baseDir)
                .addJob("protos/kitchen-sink.proto", "justNames.ftl")
                .setTemplateDir("templates")
                .setOutputFunction(this::capture);

        project.compile();
        project.compile();

        MessageDescriptor sink = (MessageDescriptor) project.findType("kitchen.Sink").orElseThrow();
        assertThat(sink.getFields()).filteredOn(FieldDescriptor::isExtension).hasSize(2);
        assertThat(project.getDiagnostics().getInfos()).hasSize(1);
    }

    @Test
    void testClasspathIncludeOutputUsesImportName() {
        Project project = new Project(baseDir).setOutDir("out");
        project.addProto("protos/options.proto");

        ProtoDescriptor descriptor = project.getProtos().get(1);

        assertThat(project.getOutputPath(descriptor, ".txt"))
                .isEqualTo(baseDir.resolve("out/google/protobuf/descriptor.proto.txt"));
        assertThat(project.getOutputPath(descriptor, ".java"))
                .isEqualTo(baseDir.resolve("out/google/protobuf/DescriptorProtos.java"));
    }

    @Test
    void testProtoPathsCannotChangeAfterLoad() {
        Project project = new Project(baseDir);
        project.addProto("protos/vehicle.proto");

        assertThatThrownBy(() -> project.setProtoPaths(List.of(Path.of("protos"))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testCustomProtoPath() {
        Project project = new Project(baseDir).setProtoPaths(List.of(Path.of("protos")));

        ProtoDescriptor loop = project.addProto("loop.proto");

        assertThat(loop.getPackageName()).isEqualTo("loop");
    }

    private void capture(ProtoDescriptor proto, Path outputPath, String contents) {
        written.add(new GeneratedFile(proto, outputPath, contents));
    }

    private static String fullNameOf(Object field) {
        Map<?, ?> type = (Map<?, ?>) ((Map<?, ?>) field).get("typeDescriptor");
        return (String) type.get("fullName");
    }

    private static List<Object> camelNames(Map<?, ?> message) {
        List<Object> names = new ArrayList<>();
        for (Object field : (List<?>) message.get("fields")) {
            names.add(((Map<?, ?>) field).get("camelName"));
        }
        return names;
    }
}
