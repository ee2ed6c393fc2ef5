// This file is part of TSRead.
// Copyright (C) 2024  The TSRead Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsread.query.serdes;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xerial.snappy.Snappy;
import org.xerial.snappy.SnappyError;

import com.google.common.collect.Lists;
import com.google.common.io.ByteStreams;
import com.google.protobuf.InvalidProtocolBufferException;

import net.tsread.data.Labels;
import net.tsread.data.Sample;
import net.tsread.data.TimeSeries;
import net.tsread.data.pbuf.RemotePB;
import net.tsread.data.pbuf.TypesPB;
import net.tsread.exceptions.EncodingFailureException;
import net.tsread.exceptions.MalformedPayloadException;
import net.tsread.exceptions.PayloadTooLargeException;
import net.tsread.query.LabelMatcher;
import net.tsread.query.LabelMatcher.MatchType;
import net.tsread.query.QueryResult;
import net.tsread.query.ReadHints;
import net.tsread.query.ReadRequest;
import net.tsread.query.ReadResponse;
import net.tsread.query.SubQuery;

/**
 * Encodes and decodes Prometheus remote read messages: protobuf bodies 
 * compressed as a single raw snappy block (not the framed stream format).
 * Every size check happens before the payload is decompressed or parsed.
 * 
 * @since 1.0
 */
public final class RemoteReadSerdes {
  private static final Logger LOG = LoggerFactory.getLogger(
      RemoteReadSerdes.class);
  
  /** The default request size ceiling, 1 MiB. */
  public static final int DEFAULT_MAX_REQUEST_BYTES = 1024 * 1024;
  
  /** Content type of requests and responses. */
  public static final String CONTENT_TYPE = "application/x-protobuf";
  
  /** Content encoding of requests and responses. */
  public static final String CONTENT_ENCODING = "snappy";
  
  private RemoteReadSerdes() {
    // static utility
  }
  
  /**
   * Decodes a read request.
   * @param stream A non-null stream with the compressed body.
   * @param declared_length The length the client declared, negative if 
   * unknown.
   * @param max_size The maximum compressed and decompressed size in bytes.
   * @return The decoded request.
   * @throws IllegalArgumentException if the stream was null or the max size
   * was less than 1.
   * @throws PayloadTooLargeException if the declared, compressed or 
   * decompressed size was over the max.
   * @throws MalformedPayloadException if the body couldn't be read, 
   * decompressed or parsed, or a matcher was invalid.
   */
  public static ReadRequest deserialize(final InputStream stream, 
                                        final long declared_length, 
                                        final int max_size) {
    if (stream == null) {
      throw new IllegalArgumentException("Stream cannot be null.");
    }
    if (max_size < 1) {
      throw new IllegalArgumentException("Max size must be greater than 0.");
    }
    if (declared_length > max_size) {
      throw new PayloadTooLargeException(declared_length, max_size);
    }
    
    final byte[] compressed;
    try {
      compressed = ByteStreams.toByteArray(
          ByteStreams.limit(stream, (long) max_size + 1));
    } catch (IOException e) {
      throw new MalformedPayloadException("Failed to read the request body: " 
          + e.getMessage(), e);
    }
    if (compressed.length > max_size) {
      throw new PayloadTooLargeException(compressed.length, max_size);
    }
    
    final RemotePB.ReadRequest request;
    try {
      request = RemotePB.ReadRequest.parseFrom(decompress(compressed, max_size));
    } catch (InvalidProtocolBufferException e) {
      throw new MalformedPayloadException("Failed to parse the read request: " 
          + e.getMessage(), e);
    }
    
    final List<SubQuery> queries = 
        Lists.newArrayListWithCapacity(request.getQueriesCount());
    for (int i = 0; i < request.getQueriesCount(); i++) {
      queries.add(fromPB(i, request.getQueries(i)));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Decoded a read request with " + queries.size() 
          + " queries from " + compressed.length + " bytes.");
    }
    return new ReadRequest(queries);
  }
  
  /**
   * Encodes a read response.
   * @param response A non-null response.
   * @return The snappy compressed protobuf body.
   * @throws IllegalArgumentException if the response was null.
   * @throws EncodingFailureException if compression failed.
   */
  public static byte[] serialize(final ReadResponse response) {
    if (response == null) {
      throw new IllegalArgumentException("Response cannot be null.");
    }
    final RemotePB.ReadResponse.Builder builder = 
        RemotePB.ReadResponse.newBuilder();
    for (final QueryResult result : response.results()) {
      final RemotePB.QueryResult.Builder result_builder = 
          RemotePB.QueryResult.newBuilder();
      for (final TimeSeries series : result.timeSeries()) {
        result_builder.addTimeseries(toPB(series));
      }
      builder.addResults(result_builder);
    }
    return compress(builder.build().toByteArray(), "response");
  }
  
  /**
   * Encodes a read request, as a remote read client would.
   * @param request A non-null request.
   * @return The snappy compressed protobuf body.
   * @throws IllegalArgumentException if the request was null.
   * @throws EncodingFailureException if compression failed.
   */
  public static byte[] serialize(final ReadRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    final RemotePB.ReadRequest.Builder builder = 
        RemotePB.ReadRequest.newBuilder()
          .addAcceptedResponseTypes(RemotePB.ReadRequest.ResponseType.SAMPLES);
    for (final SubQuery query : request.queries()) {
      builder.addQueries(toPB(query));
    }
    return compress(builder.build().toByteArray(), "request");
  }
  
  /**
   * Decodes a read response, as a remote read client would.
   * @param data A non-null compressed body.
   * @param max_size The maximum compressed and decompressed size in bytes.
   * @return The decoded response.
   * @throws IllegalArgumentException if the data was null or the max size
   * was less than 1.
   * @throws PayloadTooLargeException if the body was over the max.
   * @throws MalformedPayloadException if the body couldn't be decompressed
   * or parsed.
   */
  public static ReadResponse deserializeResponse(final byte[] data, 
                                                 final int max_size) {
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    if (max_size < 1) {
      throw new IllegalArgumentException("Max size must be greater than 0.");
    }
    if (data.length > max_size) {
      throw new PayloadTooLargeException(data.length, max_size);
    }
    final RemotePB.ReadResponse response;
    try {
      response = RemotePB.ReadResponse.parseFrom(decompress(data, max_size));
    } catch (InvalidProtocolBufferException e) {
      throw new MalformedPayloadException("Failed to parse the read response: " 
          + e.getMessage(), e);
    }
    final List<QueryResult> results = 
        Lists.newArrayListWithCapacity(response.getResultsCount());
    for (final RemotePB.QueryResult result : response.getResultsList()) {
      final List<TimeSeries> series = 
          Lists.newArrayListWithCapacity(result.getTimeseriesCount());
      for (final TypesPB.TimeSeries pb : result.getTimeseriesList()) {
        series.add(fromPB(pb));
      }
      results.add(new QueryResult(series));
    }
    return new ReadResponse(results);
  }
  
  /**
   * Checks the block header then decompresses.
   * @param compressed The raw snappy block.
   * @param max_size The decompressed ceiling.
   * @return The decompressed bytes.
   */
  static byte[] decompress(final byte[] compressed, final int max_size) {
    if (compressed.length == 0) {
      throw new MalformedPayloadException("Empty snappy block.");
    }
    final int length;
    try {
      length = Snappy.uncompressedLength(compressed);
    } catch (IOException | SnappyError e) {
      throw new MalformedPayloadException("Invalid snappy block header: " 
          + e.getMessage(), e);
    }
    if (length < 0) {
      throw new MalformedPayloadException("Invalid snappy block header, "
          + "negative length: " + length);
    }
    if (length > max_size) {
      throw new PayloadTooLargeException(length, max_size);
    }
    if (length == 0) {
      return new byte[0];
    }
    try {
      final byte[] raw = new byte[length];
      final int read = Snappy.uncompress(compressed, 0, compressed.length, 
          raw, 0);
      if (read != length) {
        throw new MalformedPayloadException("Snappy block decompressed to " 
            + read + " bytes but the header declared " + length);
      }
      return raw;
    } catch (IOException | SnappyError e) {
      throw new MalformedPayloadException("Invalid snappy block: " 
          + e.getMessage(), e);
    }
  }
  
  private static byte[] compress(final byte[] raw, final String what) {
    try {
      return Snappy.compress(raw);
    } catch (IOException | SnappyError e) {
      throw new EncodingFailureException("Failed to compress the " + what 
          + ": " + e.getMessage(), e);
    }
  }
  
  private static SubQuery fromPB(final int index, final RemotePB.Query query) {
    final SubQuery.Builder builder = SubQuery.newBuilder()
        .setStartMs(query.getStartTimestampMs())
        .setEndMs(query.getEndTimestampMs());
    for (final TypesPB.LabelMatcher matcher : query.getMatchersList()) {
      final MatchType type;
      switch (matcher.getType()) {
      case EQ:
        type = MatchType.EQ;
        break;
      case NEQ:
        type = MatchType.NEQ;
        break;
      case RE:
        type = MatchType.RE;
        break;
      case NRE:
        type = MatchType.NRE;
        break;
      default:
        throw new MalformedPayloadException("Unknown matcher type " 
            + matcher.getTypeValue() + " in query " + index);
      }
      try {
        builder.addMatcher(new LabelMatcher(type, matcher.getName(), 
            matcher.getValue()));
      } catch (IllegalArgumentException e) {
        throw new MalformedPayloadException("Invalid matcher in query " 
            + index + ": " + e.getMessage(), e);
      }
    }
    if (query.hasHints()) {
      final TypesPB.ReadHints hints = query.getHints();
      builder.setHints(ReadHints.newBuilder()
          .setStepMs(hints.getStepMs())
          .setFunc(hints.getFunc())
          .setStartMs(hints.getStartMs())
          .setEndMs(hints.getEndMs())
          .setGrouping(hints.getGroupingList())
          .setBy(hints.getBy())
          .setRangeMs(hints.getRangeMs())
          .build());
    }
    return builder.build();
  }
  
  private static RemotePB.Query toPB(final SubQuery query) {
    final RemotePB.Query.Builder builder = RemotePB.Query.newBuilder()
        .setStartTimestampMs(query.getStartMs())
        .setEndTimestampMs(query.getEndMs());
    for (final LabelMatcher matcher : query.getMatchers()) {
      builder.addMatchers(TypesPB.LabelMatcher.newBuilder()
          .setType(TypesPB.LabelMatcher.Type.valueOf(matcher.type().name()))
          .setName(matcher.name())
          .setValue(matcher.value()));
    }
    final ReadHints hints = query.getHints();
    if (hints != null) {
      final TypesPB.ReadHints.Builder hints_builder = 
          TypesPB.ReadHints.newBuilder()
            .setStepMs(hints.getStepMs())
            .setStartMs(hints.getStartMs())
            .setEndMs(hints.getEndMs())
            .setBy(hints.isBy())
            .setRangeMs(hints.getRangeMs());
      if (hints.getFunc() != null) {
        hints_builder.setFunc(hints.getFunc());
      }
      if (hints.getGrouping() != null) {
        hints_builder.addAllGrouping(hints.getGrouping());
      }
      builder.setHints(hints_builder);
    }
    return builder.build();
  }
  
  private static TypesPB.TimeSeries toPB(final TimeSeries series) {
    final TypesPB.TimeSeries.Builder builder = TypesPB.TimeSeries.newBuilder();
    for (final net.tsread.data.Label label : series.labels()) {
      builder.addLabels(TypesPB.Label.newBuilder()
          .setName(label.name())
          .setValue(label.value()));
    }
    for (final Sample sample : series.samples()) {
      builder.addSamples(TypesPB.Sample.newBuilder()
          .setTimestamp(sample.timestamp())
          .setValue(sample.value()));
    }
    return builder.build();
  }
  
  private static TimeSeries fromPB(final TypesPB.TimeSeries series) {
    final Labels.Builder labels = Labels.newBuilder();
    for (final TypesPB.Label label : series.getLabelsList()) {
      labels.add(label.getName(), label.getValue());
    }
    final List<Sample> samples = 
        Lists.newArrayListWithCapacity(series.getSamplesCount());
    for (final TypesPB.Sample sample : series.getSamplesList()) {
      samples.add(new Sample(sample.getTimestamp(), sample.getValue()));
    }
    return new TimeSeries(labels.build(), samples);
  }
}
