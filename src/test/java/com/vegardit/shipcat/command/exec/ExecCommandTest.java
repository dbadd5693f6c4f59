/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.command.exec;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import com.vegardit.shipcat.ShipCatMain;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@DisabledOnOs(OS.WINDOWS)
class ExecCommandTest {

   @Test
   void testExitCodeIsPassedThrough() {
      assertThat(ShipCatMain.newCommandLine().execute("exec", "/bin/sh", "-c", "exit 0")).isZero();
      assertThat(ShipCatMain.newCommandLine().execute("exec", "/bin/sh", "-c", "exit 4")).isEqualTo(4);
   }

   @Test
   void testOptionsBeforeExecutable() {
      final var cli = ShipCatMain.newCommandLine();
      final int exitCode = cli.execute("exec", "--env", "SHIPCAT_CODE=5", "--poll-interval", "PT0.01S", "/bin/sh", "-c",
         "exit $SHIPCAT_CODE");
      assertThat(exitCode).isEqualTo(5);

      final ExecCommand cmd = cli.getSubcommands().get("exec").getCommand();
      final var outcome = cmd.getOutcome();
      assertThat(outcome).isNotNull();
      assertThat(outcome.started()).isTrue();
      assertThat(outcome.exitCode()).isEqualTo(5);
   }

   @Test
   void testTimeout() {
      final var cli = ShipCatMain.newCommandLine();
      assertThat(cli.execute("exec", "--timeout", "PT0.3S", "/bin/sh", "-c", "exec sleep 30")).isEqualTo(1);
      final ExecCommand cmd = cli.getSubcommands().get("exec").getCommand();
      assertThat(cmd.getOutcome()).isNotNull();
      assertThat(cmd.getOutcome().isSuccess()).isFalse();
   }

   @Test
   void testUnknownExecutable() {
      assertThat(ShipCatMain.newCommandLine().execute("exec", "/does/not/exist/tool")).isEqualTo(1);
      assertThat(ShipCatMain.newCommandLine().execute("exec")).isEqualTo(1);
   }
}
