package edu.uw.easysva.main;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;

import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Maps;
import com.google.common.io.CharStreams;

import edu.uw.easysva.analysis.AnalysisResult;
import edu.uw.easysva.analysis.EngineType;
import edu.uw.easysva.analysis.SvaEngine;
import edu.uw.easysva.lexicon.Lexicon;
import edu.uw.easysva.util.Util;

/**
 * JSON front end. POST /parse takes {"sentence": ..., "engine": "csg"|"rule"}; GET /parse takes the same as query
 * parameters. GET /health reports that the service is up.
 */
public class WebDemo extends AbstractHandler {
	private static final Logger LOG = LoggerFactory.getLogger(WebDemo.class);

	static final int DEFAULT_PORT = 5000;
	private static final EngineType DEFAULT_ENGINE = EngineType.CSG;

	private final ObjectMapper objectMapper = new ObjectMapper();
	private final Map<EngineType, SvaEngine> engines;

	public WebDemo(final Lexicon lexicon) {
		final Map<EngineType, SvaEngine> result = new EnumMap<>(EngineType.class);
		for (final EngineType type : EngineType.values()) {
			result.put(type, type.make(lexicon));
		}
		this.engines = Maps.immutableEnumMap(result);
	}

	/**
	 * A status code and a JSON body.
	 */
	static class Reply {
		final int status;
		final String body;

		Reply(final int status, final String body) {
			this.status = status;
			this.body = body;
		}
	}

	@Override
	public void handle(final String target, final Request baseRequest, final HttpServletRequest request,
			final HttpServletResponse response) throws IOException, ServletException {
		final Reply reply;
		if ("/health".equals(target)) {
			reply = health();
		} else if ("/parse".equals(target)) {
			if ("POST".equalsIgnoreCase(request.getMethod())) {
				reply = parseJson(CharStreams.toString(request.getReader()));
			} else {
				reply = parse(request.getParameter("sentence"), request.getParameter("engine"));
			}
		} else {
			reply = error(HttpServletResponse.SC_NOT_FOUND, "Not found: " + target);
		}

		response.setContentType("application/json; charset=utf-8");
		response.setStatus(reply.status);
		response.getWriter().print(reply.body);
		baseRequest.setHandled(true);
	}

	Reply health() {
		final ObjectNode body = objectMapper.createObjectNode();
		body.put("status", "ok");
		body.put("service", "easysva");
		return new Reply(HttpServletResponse.SC_OK, body.toString());
	}

	/**
	 * An empty body is treated like an empty object.
	 */
	Reply parseJson(final String body) {
		if (body == null || body.trim().isEmpty()) {
			return parse("", null);
		}

		final JsonNode request;
		try {
			request = objectMapper.readTree(body);
		} catch (final JsonProcessingException e) {
			LOG.debug("Rejecting malformed request body", e);
			return error(HttpServletResponse.SC_BAD_REQUEST, "Malformed JSON request: " + e.getOriginalMessage());
		}
		if (!request.isObject()) {
			return error(HttpServletResponse.SC_BAD_REQUEST, "Expected a JSON object");
		}

		return parse(request.path("sentence").asText(""), request.path("engine").asText(""));
	}

	Reply parse(final String sentence, final String engineName) {
		final SvaEngine engine = engines.get(engineFor(engineName));
		final AnalysisResult result = engine.analyze(sentence == null ? "" : sentence);
		try {
			return new Reply(HttpServletResponse.SC_OK, objectMapper.writeValueAsString(result));
		} catch (final JsonProcessingException e) {
			LOG.error("Could not serialize result for [{}]", sentence, e);
			return error(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Could not serialize result");
		}
	}

	private static EngineType engineFor(final String engineName) {
		if (engineName == null || engineName.isEmpty()) {
			return DEFAULT_ENGINE;
		}
		try {
			return EngineType.fromName(engineName);
		} catch (final IllegalArgumentException e) {
			LOG.warn("{} Using {}.", e.getMessage(), DEFAULT_ENGINE);
			return DEFAULT_ENGINE;
		}
	}

	private Reply error(final int status, final String message) {
		final ObjectNode body = objectMapper.createObjectNode();
		body.put("status", "error");
		body.put("message", message);
		return new Reply(status, body.toString());
	}

	/**
	 * Usage: WebDemo [port] [lexicon folder]
	 */
	public static void main(final String[] args) throws Exception {
		final int port = args.length > 0 ? Integer.valueOf(args[0]) : DEFAULT_PORT;
		final Lexicon lexicon = args.length > 1 ? Lexicon.load(Util.getFile(args[1])) : Lexicon.loadDefault();

		final Server server = new Server(port);
		server.setHandler(new WebDemo(lexicon));
		server.start();
		LOG.info("Listening on port {}", port);
		server.join();
	}
}
