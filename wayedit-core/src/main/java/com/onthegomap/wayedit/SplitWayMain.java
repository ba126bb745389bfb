package com.onthegomap.wayedit;

import com.onthegomap.wayedit.config.Arguments;
import com.onthegomap.wayedit.config.WayEditConfig;
import com.onthegomap.wayedit.edits.ConflictException;
import com.onthegomap.wayedit.edits.split.SplitRequest;
import com.onthegomap.wayedit.edits.split.SplitWayAction;
import com.onthegomap.wayedit.mapdata.ElementIdProvider;
import com.onthegomap.wayedit.mapdata.InMemoryMapDataRepository;
import com.onthegomap.wayedit.mapdata.OsmJson;
import com.onthegomap.wayedit.osm.OsmElement;
import com.onthegomap.wayedit.util.LogUtil;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line tool that splits one way of an OSM JSON file and writes the elements that changed.
 * <p>
 * Example: {@code split-way input=data.json way=123 splits="point:53.5,9.9;segment:4,53.51,9.91" output=edits.json}
 */
public class SplitWayMain {

  private static final Logger LOGGER = LoggerFactory.getLogger(SplitWayMain.class);

  private SplitWayMain() {}

  public static void main(String[] args) {
    int status = run(Arguments.fromArgsOrConfigFile(args).withExactlyOnceLogging());
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs the tool and returns the process exit code. */
  static int run(Arguments arguments) {
    LogUtil.setStage("split");
    try {
      var config = WayEditConfig.from(arguments);
      Path input = arguments.inputFile("input", "OSM JSON file with the way, its nodes, and its relations");
      long wayId = arguments.getLong("way", "ID of the way to split");
      List<SplitRequest> splits = arguments.getObject("splits",
        "where to split, separated by ';': point:lat,lon index:i line:lat1,lon1,lat2,lon2,lat,lon segment:i,lat,lon",
        List.of(), SplitRequest::parseAll);
      Path output = arguments.file("output", "file to write to, standard output if not set", null);
      boolean apply = arguments.getBoolean("apply",
        "write the whole updated data set instead of only the elements that changed", false);

      InMemoryMapDataRepository mapData;
      try (var in = Files.newInputStream(input)) {
        mapData = OsmJson.read(in);
      }
      var way = mapData.getWay(wayId);
      long firstNode = arguments.getLong("first_node", "first node of the way when the split was made",
        way == null ? 0 : way.firstNode());
      long lastNode = arguments.getLong("last_node", "last node of the way when the split was made",
        way == null ? 0 : way.lastNode());

      var action = new SplitWayAction(splits, firstNode, lastNode);
      LOGGER.info("Splitting way #{} at {} positions, expecting {}", wayId, splits.size(), action.newElementsCount());
      var updates = action.createUpdates(wayId, mapData, ElementIdProvider.sequential(config.idStart()));
      LOGGER.info("Created {} nodes, updated {} ways and {} relations", updates.createdNodes().size(),
        updates.updatedWays().size(), updates.updatedRelations().size());

      List<OsmElement> result;
      if (apply) {
        mapData.putAll(updates.all());
        result = mapData.elements();
      } else {
        result = updates.all();
      }
      if (output == null) {
        OsmJson.write(result, System.out, config.prettyPrint());
        System.out.println();
      } else {
        try (OutputStream out = Files.newOutputStream(output)) {
          OsmJson.write(result, out, config.prettyPrint());
        }
        LOGGER.info("Wrote {} elements to {}", result.size(), output);
      }
      return 0;
    } catch (ConflictException e) {
      LOGGER.error("Unable to split way: {} ({})", e.getMessage(), e.stat());
      return 1;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } finally {
      LogUtil.clearStage();
    }
  }
}
