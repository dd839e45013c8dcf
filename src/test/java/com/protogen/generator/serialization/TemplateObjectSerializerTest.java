package com.protogen.generator.serialization;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import com.protogen.generator.TestResources;
import com.protogen.generator.codegen.Project;
import com.protogen.generator.model.FieldDescriptor;
import com.protogen.generator.model.MessageDescriptor;
import com.protogen.generator.model.ProtoDescriptor;

/**
 * Tests for the nested map view handed to templates.
 */
class TemplateObjectSerializerTest {

    private Project project;

    @BeforeEach
    void setUp() {
        project = new Project(TestResources.baseDir());
    }

    @Test
    void testFileShape() {
        Map<String, Object> file = project.addProto("protos/person.proto").toTemplateObject();

        assertThat(file).containsEntry("name", "person.proto")
                .containsEntry("package", "examples")
                .containsEntry("syntax", "proto2")
                .containsKeys("filePath", "options", "messages", "enums", "services");
        assertThat(options(file)).containsEntry("java_outer_classname", "PersonProtos");

        List<Map<String, Object>> imports = list(file, "imports");
        assertThat(imports).singleElement().satisfies(imported -> {
            assertThat(imported).containsEntry("name", "common.proto").containsEntry("package", "common");
            assertThat(imported).doesNotContainKey("messages");
        });
    }

    @Test
    void testEnumShape() {
        Map<String, Object> file = project.addProto("protos/person.proto").toTemplateObject();

        Map<String, Object> person = list(file, "messages").get(0);
        List<Map<String, Object>> enums = list(person, "enums");

        assertThat(enums).containsExactly(Map.of(
                "name", "PhoneType",
                "values", List.of(
                        Map.of("name", "MOBILE", "titleName", "Mobile", "number", 0),
                        Map.of("name", "HOME", "titleName", "Home", "number", 1),
                        Map.of("name", "WORK", "titleName", "Work", "number", 2),
                        Map.of("name", "WORK_FAX", "titleName", "WorkFax", "number", 3)),
                "isEnum", true,
                "fullName", "examples.Person.PhoneType"));
    }

    @Test
    void testFieldShape() {
        MessageDescriptor person = project.addProto("protos/person.proto").findMessage("Person").orElseThrow();

        Map<String, Object> customFields = person.findField("customFields").orElseThrow().toTemplateObject();
        assertThat(customFields).containsEntry("camelName", "customFields")
                .containsEntry("titleName", "CustomFields")
                .containsEntry("upperUnderscoreName", "CUSTOM_FIELDS")
                .containsEntry("rawType", "common.StringPair")
                .containsEntry("label", "repeated")
                .containsEntry("isRepeated", true)
                .containsEntry("isNative", false)
                .containsEntry("isMessage", true)
                .containsEntry("isEnum", false)
                .doesNotContainKeys("defaultValue", "oneof", "isExtension");
        assertThat(map(customFields, "typeDescriptor")).containsEntry("name", "StringPair")
                .containsEntry("fullName", "common.StringPair");

        Map<String, Object> email = person.findField("email").orElseThrow().toTemplateObject();
        assertThat(email).containsEntry("isNative", true).doesNotContainKey("typeDescriptor");
    }

    @Test
    void testDefaultValueAndEnumReference() {
        MessageDescriptor phone = project.addProto("protos/person.proto").findType("Person.PhoneNumber")
                .map(MessageDescriptor.class::cast).orElseThrow();

        Map<String, Object> type = phone.findField("type").orElseThrow().toTemplateObject();

        assertThat(type).containsEntry("defaultValue", "HOME").containsEntry("isEnum", true);
        assertThat(map(type, "typeDescriptor")).containsEntry("fullName", "examples.Person.PhoneType");
    }

    @Test
    void testMutualRecursionTerminatesWithStub() {
        MessageDescriptor dee = project.addProto("protos/loop.proto").findMessage("TweedleDee").orElseThrow();

        Map<String, Object> deeObject = dee.toTemplateObject();

        Map<String, Object> dum = map(list(deeObject, "fields").get(0), "typeDescriptor");
        assertThat(dum).containsEntry("name", "TweedleDum");
        assertThat(list(dum, "fields")).hasSize(1);

        Map<String, Object> backReference = map(list(dum, "fields").get(0), "typeDescriptor");
        assertThat(backReference).containsEntry("fullName", "loop.TweedleDee")
                .containsEntry("isRecursiveReference", true)
                .doesNotContainKey("fields");
    }

    @Test
    void testReferencedMessageIsInlinedWithItsFields() {
        ProtoDescriptor proto = project.addProto("protos/person.proto");
        MessageDescriptor book = proto.findMessage("AddressBook").orElseThrow();

        Map<String, Object> people = map(list(book.toTemplateObject(), "fields").get(0), "typeDescriptor");

        assertThat(people).containsEntry("fullName", "examples.Person");
        assertThat(list(people, "fields")).hasSize(6);
    }

    @Test
    void testSiblingReferencesAreInlinedInFull() {
        ProtoDescriptor proto = project.addProto("protos/inner.proto");

        Map<String, Object> plate = list(proto.toTemplateObject(), "messages").get(2);
        List<Map<String, Object>> fields = list(plate, "fields");

        assertThat(map(fields.get(0), "typeDescriptor")).containsEntry("fullName", "burrito.Filling");
        assertThat(map(fields.get(1), "typeDescriptor")).containsEntry("fullName", "burrito.Tortilla.Filling")
                .doesNotContainKey("isRecursiveReference");
    }

    @Test
    @Timeout(10)
    void testSharedReferencesAreRenderedOnce(@TempDir Path tempDir) throws IOException {
        StringBuilder source = new StringBuilder("package chain;\n");
        for (int i = 0; i < 30; i++) {
            source.append("message M").append(i).append(" { optional M").append(i + 1).append(" a = 1; optional M")
                    .append(i + 1).append(" b = 2; }\n");
        }
        source.append("message M30 { optional string end = 1; }\n");
        Files.writeString(tempDir.resolve("chain.proto"), source.toString());

        MessageDescriptor head = new Project(tempDir).addProto("chain.proto").findMessage("M0").orElseThrow();
        Map<String, Object> object = head.toTemplateObject();

        List<Map<String, Object>> fields = list(object, "fields");
        Map<String, Object> next = map(fields.get(0), "typeDescriptor");
        assertThat(next).containsEntry("fullName", "chain.M1").doesNotContainKey("isRecursiveReference");
        assertThat(map(fields.get(1), "typeDescriptor")).isSameAs(next);

        Map<String, Object> last = object;
        for (int i = 1; i <= 30; i++) {
            last = map(list(last, "fields").get(1), "typeDescriptor");
        }
        assertThat(last).containsEntry("fullName", "chain.M30");
        assertThat(list(last, "fields")).singleElement().satisfies(end -> assertThat(end).containsEntry("name", "end"));
    }

    @Test
    void testMethodShape() {
        Map<String, Object> shoes = project.addProto("protos/services.proto").toTemplateObject();

        Map<String, Object> service = list(shoes, "services").get(0);
        assertThat(service).containsEntry("fullName", "shoes.RunningShoe").containsEntry("camelName", "runningShoe");

        Map<String, Object> track = list(service, "methods").get(1);
        assertThat(track).containsEntry("name", "TrackStrides")
                .containsEntry("upperUnderscoreName", "TRACK_STRIDES")
                .containsEntry("clientStreaming", true)
                .containsEntry("serverStreaming", true);
        assertThat(options(track)).containsEntry("deprecated", true);
    }

    @Test
    void testUnresolvedReferenceCannotBeSerialized() {
        FieldDescriptor loose = FieldDescriptor.builder().name("loose").rawType("Nowhere").number(1).build();

        assertThatThrownBy(() -> new TemplateObjectSerializer().serialize(loose))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Nowhere");
    }

    @Test
    void testNoNullValues() {
        Map<String, Object> file = project.addProto("protos/kitchen-sink.proto").toTemplateObject();

        assertNoNulls(file);
    }

    private static void assertNoNulls(Object node) {
        if (node instanceof Map<?, ?> map) {
            map.forEach((key, value) -> {
                assertThat(value).as("value of %s", key).isNotNull();
                assertNoNulls(value);
            });
        } else if (node instanceof List<?> items) {
            items.forEach(TemplateObjectSerializerTest::assertNoNulls);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Map<String, Object> object, String key) {
        return (Map<String, Object>) object.get(key);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(Map<String, Object> object, String key) {
        return (List<Map<String, Object>>) object.get(key);
    }

    private static Map<String, Object> options(Map<String, Object> object) {
        return map(object, "options");
    }
}
