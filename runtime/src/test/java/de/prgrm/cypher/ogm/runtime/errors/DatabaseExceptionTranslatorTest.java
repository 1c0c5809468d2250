package de.prgrm.cypher.ogm.runtime.errors;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.TransientException;

class DatabaseExceptionTranslatorTest {

    @Test
    void constraintCodesBecomeConstraintViolations() {
        ClientException cause = new ClientException("Neo.ClientError.Schema.ConstraintValidationFailed",
                "Node(0) already exists with label `User`");

        DatabaseException e = DatabaseExceptionTranslator.translate(cause, " CREATE (n:User) ");

        assertInstanceOf(ConstraintViolationException.class, e);
        assertSame(cause, e.getCause());
        assertEquals("Node(0) already exists with label `User` "
                + "(code=Neo.ClientError.Schema.ConstraintValidationFailed) [query: CREATE (n:User)]", e.getMessage());
    }

    @Test
    void memgraphConstraintMessagesAreRecognized() {
        ClientException cause = new ClientException("Memgraph.ClientError.MemgraphError.MemgraphError",
                "Unable to commit due to unique constraint violation on :User(name)");

        assertInstanceOf(ConstraintViolationException.class, DatabaseExceptionTranslator.translate(cause, null));
    }

    @Test
    void transientFailures() {
        assertInstanceOf(TransientDatabaseException.class, DatabaseExceptionTranslator.translate(
                new TransientException("Neo.TransientError.Transaction.DeadlockDetected", "deadlock"), "q"));
        assertInstanceOf(TransientDatabaseException.class, DatabaseExceptionTranslator.translate(
                new ServiceUnavailableException("no route"), "q"));
        assertInstanceOf(TransientDatabaseException.class, DatabaseExceptionTranslator.translate(
                new IllegalStateException("wrapped", new ServiceUnavailableException("no route")), "q"));
    }

    @Test
    void syntaxErrorsStayGeneric() {
        DatabaseException e = DatabaseExceptionTranslator.translate(
                new ClientException("Neo.ClientError.Statement.SyntaxError", "Invalid input 'RETRUN'"), "RETRUN 1");

        assertEquals(DatabaseException.class, e.getClass());
        assertTrue(e.getMessage().startsWith("Invalid input 'RETRUN'"));
    }

    @Test
    void translatedExceptionsPassThrough() {
        NotFoundException notFound = new NotFoundException("gone");
        DatabaseException database = new DatabaseException("already translated");

        assertSame(database, DatabaseExceptionTranslator.translate(database, "q"));
        assertEquals(DatabaseException.class, DatabaseExceptionTranslator.translate(notFound, "q").getClass());
    }

    @Test
    void unknownFailuresKeepTheirCause() {
        RuntimeException cause = new RuntimeException("boom");

        DatabaseException e = DatabaseExceptionTranslator.translate(cause, "RETURN 1");

        assertSame(cause, e.getCause());
        assertEquals("boom [query: RETURN 1]", e.getMessage());
    }
}
