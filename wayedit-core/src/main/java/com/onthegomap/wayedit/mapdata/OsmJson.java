package com.onthegomap.wayedit.mapdata;

import com.carrotsearch.hppc.LongArrayList;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.onthegomap.wayedit.edits.ElementUpdates;
import com.onthegomap.wayedit.geo.LatLon;
import com.onthegomap.wayedit.osm.OsmElement;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes map data in the JSON format of the OSM API, for example:
 * <pre>{@code
 * {"version": "0.6", "elements": [
 *   {"type": "node", "id": 1, "version": 2, "lat": 53.5, "lon": 9.9, "tags": {"barrier": "gate"}},
 *   {"type": "way", "id": 2, "version": 1, "nodes": [1, 3], "tags": {"highway": "residential"}},
 *   {"type": "relation", "id": 3, "version": 1, "members": [{"type": "way", "ref": 2, "role": "from"}]}
 * ]}
 * }</pre>
 */
public class OsmJson {

  private static final ObjectMapper MAPPER = JsonMapper.builder()
    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
    .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
    .serializationInclusion(JsonInclude.Include.NON_NULL)
    .build();

  private OsmJson() {}

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  record Document(String version, List<Element> elements) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record Element(
    String type,
    long id,
    Integer version,
    Double lat,
    Double lon,
    long[] nodes,
    List<Member> members,
    Map<String, String> tags
  ) {}

  record Member(String type, long ref, String role) {}

  /**
   * Returns a repository with every element of an OSM API JSON document.
   *
   * @throws UncheckedIOException     if the input cannot be read or is not valid JSON
   * @throws IllegalArgumentException if an element is invalid
   */
  public static InMemoryMapDataRepository read(InputStream input) {
    Document document;
    try {
      document = MAPPER.readValue(input, Document.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read OSM JSON", e);
    }
    var repository = MapDataRepository.newInMemory();
    if (document.elements() != null) {
      repository.putAll(document.elements().stream().map(OsmJson::toElement).toList());
    }
    return repository;
  }

  /** Writes {@code elements} to {@code output} as an OSM API JSON document, leaving {@code output} open. */
  public static void write(List<? extends OsmElement> elements, OutputStream output, boolean pretty) {
    var document = new Document("0.6", elements.stream().map(OsmJson::fromElement).toList());
    try {
      (pretty ? MAPPER.writerWithDefaultPrettyPrinter() : MAPPER.writer()).writeValue(output, document);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write OSM JSON", e);
    }
  }

  /** Writes the elements created or modified by an edit to {@code output}. */
  public static void write(ElementUpdates updates, OutputStream output, boolean pretty) {
    write(updates.all(), output, pretty);
  }

  /** Returns {@code elements} as an OSM API JSON string. */
  public static String toJson(List<? extends OsmElement> elements) {
    try {
      return MAPPER.writeValueAsString(new Document("0.6", elements.stream().map(OsmJson::fromElement).toList()));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static OsmElement toElement(Element element) {
    if (element.type() == null) {
      throw new IllegalArgumentException("Element " + element.id() + " has no type");
    }
    int version = element.version() == null ? 0 : element.version();
    return switch (OsmElement.Type.fromApiName(element.type())) {
      case NODE -> {
        if (element.lat() == null || element.lon() == null) {
          throw new IllegalArgumentException("Node " + element.id() + " has no position");
        }
        yield new OsmElement.Node(element.id(), version, element.tags(),
          new LatLon(element.lat(), element.lon()));
      }
      case WAY -> new OsmElement.Way(element.id(), version, element.tags(),
        element.nodes() == null ? new LongArrayList() : LongArrayList.from(element.nodes()));
      case RELATION -> {
        List<OsmElement.Relation.Member> members = new ArrayList<>();
        if (element.members() != null) {
          for (var member : element.members()) {
            if (member.type() == null) {
              throw new IllegalArgumentException(
                "Member " + member.ref() + " of relation " + element.id() + " has no type");
            }
            members.add(new OsmElement.Relation.Member(OsmElement.Type.fromApiName(member.type()), member.ref(),
              member.role()));
          }
        }
        yield new OsmElement.Relation(element.id(), version, element.tags(), members);
      }
    };
  }

  private static Element fromElement(OsmElement element) {
    Map<String, String> tags = element.tags().isEmpty() ? null : element.tags();
    if (element instanceof OsmElement.Node node) {
      return new Element("node", node.id(), node.version(), node.position().lat(), node.position().lon(), null, null,
        tags);
    } else if (element instanceof OsmElement.Way way) {
      return new Element("way", way.id(), way.version(), null, null, way.nodes().toArray(), null, tags);
    } else if (element instanceof OsmElement.Relation relation) {
      List<Member> members = relation.members().stream()
        .map(member -> new Member(member.type().apiName(), member.ref(), member.role()))
        .toList();
      return new Element("relation", relation.id(), relation.version(), null, null, null, members, tags);
    }
    throw new IllegalArgumentException("Unrecognized element: " + element);
  }
}
