package io.murt;

import org.junit.Test;

import java.io.IOException;
import java.net.ConnectException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.startsWith;

public class MurtTest {

    @Test
    public void versionWorks() {
        assertThat(Murt.artifactVersion(), startsWith("0."));
    }

    @Test
    public void exceptionsAreDescribedWithTheirCauses() {
        IOException ex = new IOException("wrapped", new ConnectException("Connection refused"));
        assertThat(Murt.describe(ex), equalTo("IOException: wrapped; ConnectException: Connection refused"));
    }

    @Test
    public void exceptionsWithoutMessagesUseTheirClassName() {
        assertThat(Murt.describe(new ConnectException()), equalTo("ConnectException"));
    }
}
