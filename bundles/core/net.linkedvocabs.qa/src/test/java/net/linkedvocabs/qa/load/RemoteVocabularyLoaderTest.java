package net.linkedvocabs.qa.load;

import static net.linkedvocabs.qa.QaTestSupport.COLORS;
import static net.linkedvocabs.qa.QaTestSupport.iri;

import java.io.IOException;

import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.vocabulary.SKOS;
import org.eclipse.rdf4j.repository.Repository;
import org.eclipse.rdf4j.repository.RepositoryConnection;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.google.common.io.Resources;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import net.linkedvocabs.core.vocab.TermSet;
import net.linkedvocabs.core.vocab.VocabularyConfig;
import net.linkedvocabs.qa.QaTestSupport;

public class RemoteVocabularyLoaderTest {
	/**
	 * Serves the colors vocabulary as Turtle under different paths.
	 */
	static class VocabularyServlet extends HttpServlet {
		private static final long serialVersionUID = 1L;

		volatile String accept;

		@Override
		protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
			accept = req.getHeader("Accept");
			String path = req.getRequestURI();
			if (path.endsWith("/typed.rdf")) {
				resp.setContentType("text/turtle");
			} else if (!path.endsWith("/untyped.ttl")) {
				resp.sendError(HttpServletResponse.SC_NOT_FOUND);
				return;
			}
			resp.setStatus(HttpServletResponse.SC_OK);
			resp.getOutputStream().write(Resources.toByteArray(Resources.getResource("colors.ttl")));
		}
	}

	Server server;
	VocabularyServlet servlet;
	String baseUrl;

	Repository repository;
	VocabularyLoader loader;

	@Before
	public void beforeTest() throws Exception {
		server = new Server(0);
		ServletContextHandler contextHandler = new ServletContextHandler();
		contextHandler.setContextPath("/");
		servlet = new VocabularyServlet();
		contextHandler.addServlet(new ServletHolder(servlet), "/vocab/*");
		server.setHandler(contextHandler);
		server.start();
		baseUrl = "http://localhost:" + ((ServerConnector) server.getConnectors()[0]).getLocalPort() + "/vocab/";

		repository = QaTestSupport.createRepository();
		loader = new VocabularyLoader(repository);
	}

	@After
	public void afterTest() throws Exception {
		repository.shutDown();
		server.stop();
	}

	VocabularyConfig colors(IRI source) {
		return new VocabularyConfig("colors", COLORS, TermSet.strict(COLORS, "red", "green", "blue"), true, source,
				true);
	}

	@Test
	public void testFormatFromContentType() {
		IRI source = iri(baseUrl + "typed.rdf");
		Assert.assertEquals("Turtle content type should win over the file name", 8,
				loader.loadVocabulary(colors(source)));
		try (RepositoryConnection conn = repository.getConnection()) {
			Assert.assertEquals(8, conn.size(source));
			Assert.assertTrue(conn.hasStatement(iri(COLORS + "blue"), SKOS.PREF_LABEL, null, false, source));
		}
		Assert.assertEquals(VocabularyLoader.ACCEPT, servlet.accept);
	}

	@Test
	public void testFormatFromFileName() {
		IRI source = iri(baseUrl + "untyped.ttl");
		Assert.assertEquals(8, loader.loadVocabulary(colors(source)));
	}

	@Test
	public void testErrorStatus() {
		IRI source = iri(baseUrl + "missing.ttl");
		try {
			loader.loadVocabulary(colors(source));
			Assert.fail("Failed requests should be reported");
		} catch (VocabularyLoadException e) {
			Assert.assertTrue(e.getMessage(), e.getMessage().contains("404"));
		}
		try (RepositoryConnection conn = repository.getConnection()) {
			Assert.assertEquals(0, conn.size());
		}
	}
}
