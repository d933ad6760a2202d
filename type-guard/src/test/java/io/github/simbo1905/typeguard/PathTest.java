package io.github.simbo1905.typeguard;

import io.github.simbo1905.typeguard.Path.Segment.Branch;
import io.github.simbo1905.typeguard.Path.Segment.Field;
import io.github.simbo1905.typeguard.Path.Segment.Index;
import io.github.simbo1905.typeguard.Verdict.ArityMismatch;
import io.github.simbo1905.typeguard.Verdict.MissingProperty;
import io.github.simbo1905.typeguard.Verdict.NoUnionMemberMatched;
import io.github.simbo1905.typeguard.Verdict.TypeMismatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PathTest extends TypeGuardTestBase {

  @Test
  void rendersFieldsAndIndexes() {
    final var path = Path.root().with(new Field("items")).with(new Index(2)).with(new Field("name"));
    assertThat(path.render()).isEqualTo("value.items[2].name");
    assertThat(path.depth()).isEqualTo(3);
  }

  @Test
  void quotesKeysThatAreNotIdentifiers() {
    assertThat(Path.root().with(new Field("a b")).render()).isEqualTo("value[\"a b\"]");
    assertThat(Path.root().with(new Field("say \"hi\"")).render()).isEqualTo("value[\"say \\\"hi\\\"\"]");
    assertThat(Path.root().with(new Field("")).render()).isEqualTo("value[\"\"]");
    assertThat(Path.root().with(new Field("$ok_1")).render()).isEqualTo("value.$ok_1");
  }

  @Test
  void branchesAreRecordedButNotRenderedOrCounted() {
    final var path = new Path(List.of(new Field("a"), new Branch(1), new Index(0)));
    assertThat(path.render()).isEqualTo("value.a[0]");
    assertThat(path.depth()).isEqualTo(2);
  }

  @Test
  void rootRendersAsValue() {
    assertThat(Path.root().render()).isEqualTo("value");
    assertThat(Path.root().toString()).isEqualTo("value");
    assertThat(Path.root().depth()).isZero();
  }

  @Test
  void keyFailuresCountOneLevelBelowTheirObject() {
    final var at = Path.root().with(new Field("o"));
    assertThat(Verdict.fail(new MissingProperty("x"), at).depth()).isEqualTo(2);
    assertThat(Verdict.fail(new TypeMismatch("string", "number"), at).depth()).isEqualTo(1);
  }

  @Test
  void unionFailureIsAsDeepAsItsClosestAttempt() {
    final var deep = Verdict.fail(new TypeMismatch("string", "number"),
        new Path(List.of(new Branch(0), new Field("a"), new Field("b"))));
    final var shallow = Verdict.fail(new TypeMismatch("number", "object"), new Path(List.of(new Branch(1))));
    final var union = Verdict.fail(new NoUnionMemberMatched(List.of(deep, shallow), 0), Path.root());
    assertThat(union.depth()).isEqualTo(2);
    assertThat(Verdict.fail(new NoUnionMemberMatched(List.of(), -1), Path.root()).depth()).isZero();
  }

  @Test
  void arityMessages() {
    assertThat(new ArityMismatch(2, 2, 3).describe()).isEqualTo("expected 2 elements, got 3");
    assertThat(new ArityMismatch(1, 1, 0).describe()).isEqualTo("expected 1 element, got 0");
    assertThat(new ArityMismatch(1, -1, 0).describe()).isEqualTo("expected at least 1 element, got 0");
    assertThat(new ArityMismatch(3, -1, 2).describe()).isEqualTo("expected at least 3 elements, got 2");
  }

  @Test
  void unionWithoutAttemptsHasAPlainMessage() {
    assertThat(new NoUnionMemberMatched(List.of(), -1).describe()).isEqualTo("no union member matched");
    assertThat(Verdict.Unreachable.INSTANCE.describe()).isEqualTo("no value is assignable to never");
  }
}
